package org.waabox.completist.model;

import java.util.Collection;
import java.util.Objects;

/**
 * Aggregate statistics over a set of completeness records.
 *
 * @param total               the number of records
 * @param complete            the records at 100%
 * @param incomplete          the records below 100%
 * @param totalMissing        the missing items over every record
 * @param averageCompleteness the rounded average percentage, 0 when empty
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CompletenessStats(int total, int complete, int incomplete,
    int totalMissing, int averageCompleteness) {

  /**
   * Computes the statistics of the given records.
   *
   * @param records the records, never null
   * @return the statistics, never null
   */
  public static CompletenessStats of(
      final Collection<? extends CompletenessRecord> records) {
    Objects.requireNonNull(records, "records must not be null");
    int complete = 0;
    int missing = 0;
    long sum = 0;
    for (final CompletenessRecord record : records) {
      if (record.completenessPercentage() == 100) {
        complete++;
      }
      missing += record.missingCount();
      sum += record.completenessPercentage();
    }
    final int total = records.size();
    final int average = total == 0 ? 0 : Math.round((float) sum / total);
    return new CompletenessStats(total, complete, total - complete, missing,
        average);
  }
}
