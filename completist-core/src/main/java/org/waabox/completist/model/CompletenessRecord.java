package org.waabox.completist.model;

import java.time.Instant;

/**
 * The persisted result of analyzing one logical unit within one scope.
 *
 * <p>There is one record per (unit, scope) pair; re-analysis overwrites it.
 * The completeness percentage is always within {@code [0, 100]}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CompletenessRecord {

  /**
   * Returns the key of the analyzed unit: a series title, a collection id,
   * an artist name or an album id.
   *
   * @return the unit key, never null
   */
  String unitKey();

  /**
   * Returns the scope the unit was analyzed in.
   *
   * @return the scope, never null
   */
  Scope scope();

  /**
   * Returns the number of released catalog items.
   *
   * @return the total count
   */
  int totalCount();

  /**
   * Returns the number of owned catalog items.
   *
   * @return the owned count
   */
  int ownedCount();

  /**
   * Returns the completeness percentage.
   *
   * @return a value between 0 and 100
   */
  int completenessPercentage();

  /**
   * Returns the number of owned local items the analysis was based on.
   *
   * <p>An unchanged value is used as a proxy for "nothing relevant
   * changed" when deciding to skip a fresh record.
   *
   * @return the owned local item count
   */
  int ownedItemCount();

  /**
   * Returns the number of missing items in the record.
   *
   * @return the missing count
   */
  int missingCount();

  /**
   * Returns when the record was last written.
   *
   * @return the update instant, never null
   */
  Instant updatedAt();

  /**
   * Checks a percentage against the {@code [0, 100]} range.
   *
   * @param percentage the percentage to check
   * @return the same percentage
   *
   * @throws IllegalArgumentException if it is out of range
   */
  static int requireValidPercentage(final int percentage) {
    if (percentage < 0 || percentage > 100) {
      throw new IllegalArgumentException(
          "completenessPercentage must be within [0, 100], got: "
              + percentage);
    }
    return percentage;
  }
}
