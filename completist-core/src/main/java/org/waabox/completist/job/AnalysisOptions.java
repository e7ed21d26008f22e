package org.waabox.completist.job;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.waabox.completist.model.Scope;

/**
 * Options of a batch analysis run.
 *
 * <p>Defaults:
 * <ul>
 *   <li>skipRecentlyAnalyzed: true</li>
 *   <li>reanalyzeAfterDays: 7</li>
 *   <li>deduplicateByExternalId: unset, meaning true only for
 *       cross-provider runs</li>
 *   <li>filterVinylOnly: false</li>
 *   <li>concurrency: 5 units per batch</li>
 *   <li>checkpointEvery: 25 analyzed units</li>
 * </ul>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AnalysisOptions {

  /** The default freshness window, in days. */
  private static final int DEFAULT_REANALYZE_AFTER_DAYS = 7;

  /** The default number of units analyzed concurrently. */
  private static final int DEFAULT_CONCURRENCY = 5;

  /** The default checkpoint interval, in analyzed units. */
  private static final int DEFAULT_CHECKPOINT_EVERY = 25;

  /** The default options. */
  private static final AnalysisOptions DEFAULTS = builder().build();

  /** Whether fresh and unchanged units are skipped. */
  private final boolean skipRecentlyAnalyzed;

  /** The freshness window, in days. */
  private final int reanalyzeAfterDays;

  /** Whether to merge items across providers, null for automatic. */
  private final Boolean deduplicateByExternalId;

  /** Whether vinyl-only release groups are left out of discographies. */
  private final boolean filterVinylOnly;

  /** The number of units analyzed concurrently. */
  private final int concurrency;

  /** The checkpoint interval, in analyzed units. */
  private final int checkpointEvery;

  /** Private constructor; use the builder instead. */
  private AnalysisOptions(final Builder builder) {
    skipRecentlyAnalyzed = builder.skipRecentlyAnalyzed;
    reanalyzeAfterDays = builder.reanalyzeAfterDays;
    deduplicateByExternalId = builder.deduplicateByExternalId;
    filterVinylOnly = builder.filterVinylOnly;
    concurrency = builder.concurrency;
    checkpointEvery = builder.checkpointEvery;
  }

  /**
   * Returns the default options.
   *
   * @return the defaults, never null
   */
  public static AnalysisOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Creates a new builder initialized with the defaults.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Tells whether items must be merged across providers for a scope.
   *
   * <p>When not set explicitly, merging happens only when no single
   * provider was selected.
   *
   * @param scope the scope of the run, never null
   * @return true if items are deduplicated by external id
   */
  public boolean deduplicate(final Scope scope) {
    Objects.requireNonNull(scope, "scope must not be null");
    if (deduplicateByExternalId != null) {
      return deduplicateByExternalId;
    }
    return scope.crossProvider();
  }

  /**
   * Tells whether a record written at the given instant is still fresh.
   *
   * @param updatedAt when the record was written, never null
   * @param now       the current instant, never null
   * @return true if fewer than {@link #reanalyzeAfterDays()} days passed
   */
  public boolean isFresh(final Instant updatedAt, final Instant now) {
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    Objects.requireNonNull(now, "now must not be null");
    return Duration.between(updatedAt, now).toDays() < reanalyzeAfterDays;
  }

  /**
   * Returns whether fresh and unchanged units are skipped.
   *
   * @return true if skipping is enabled
   */
  public boolean skipRecentlyAnalyzed() {
    return skipRecentlyAnalyzed;
  }

  /**
   * Returns the freshness window, in days.
   *
   * @return the number of days
   */
  public int reanalyzeAfterDays() {
    return reanalyzeAfterDays;
  }

  /**
   * Returns whether vinyl-only release groups are left out.
   *
   * @return true if the vinyl filter is enabled
   */
  public boolean filterVinylOnly() {
    return filterVinylOnly;
  }

  /**
   * Returns the number of units analyzed concurrently.
   *
   * @return the batch size, greater than zero
   */
  public int concurrency() {
    return concurrency;
  }

  /**
   * Returns the checkpoint interval, in analyzed units.
   *
   * @return the interval, greater than zero
   */
  public int checkpointEvery() {
    return checkpointEvery;
  }

  /**
   * A fluent builder for {@link AnalysisOptions}.
   */
  public static final class Builder {

    /** Whether fresh and unchanged units are skipped. */
    private boolean skipRecentlyAnalyzed = true;

    /** The freshness window, in days. */
    private int reanalyzeAfterDays = DEFAULT_REANALYZE_AFTER_DAYS;

    /** Whether to merge items across providers, null for automatic. */
    private Boolean deduplicateByExternalId;

    /** Whether vinyl-only release groups are left out. */
    private boolean filterVinylOnly;

    /** The number of units analyzed concurrently. */
    private int concurrency = DEFAULT_CONCURRENCY;

    /** The checkpoint interval. */
    private int checkpointEvery = DEFAULT_CHECKPOINT_EVERY;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets whether fresh and unchanged units are skipped.
     *
     * @param theSkip true to skip them
     * @return this builder for chaining, never null
     */
    public Builder skipRecentlyAnalyzed(final boolean theSkip) {
      skipRecentlyAnalyzed = theSkip;
      return this;
    }

    /**
     * Sets the freshness window.
     *
     * @param theDays the number of days, not negative
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theDays is negative
     */
    public Builder reanalyzeAfterDays(final int theDays) {
      if (theDays < 0) {
        throw new IllegalArgumentException(
            "reanalyzeAfterDays must not be negative, got: " + theDays);
      }
      reanalyzeAfterDays = theDays;
      return this;
    }

    /**
     * Forces cross-provider merging on or off.
     *
     * @param theDeduplicate true to merge, false not to
     * @return this builder for chaining, never null
     */
    public Builder deduplicateByExternalId(final boolean theDeduplicate) {
      deduplicateByExternalId = theDeduplicate;
      return this;
    }

    /**
     * Sets whether vinyl-only release groups are left out.
     *
     * @param theFilter true to leave them out
     * @return this builder for chaining, never null
     */
    public Builder filterVinylOnly(final boolean theFilter) {
      filterVinylOnly = theFilter;
      return this;
    }

    /**
     * Sets the number of units analyzed concurrently.
     *
     * @param theConcurrency the batch size, greater than zero
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theConcurrency is not positive
     */
    public Builder concurrency(final int theConcurrency) {
      if (theConcurrency <= 0) {
        throw new IllegalArgumentException(
            "concurrency must be greater than 0, got: " + theConcurrency);
      }
      concurrency = theConcurrency;
      return this;
    }

    /**
     * Sets the checkpoint interval.
     *
     * @param theCheckpointEvery the interval in analyzed units, greater
     *                           than zero
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theCheckpointEvery is not
     *                                  positive
     */
    public Builder checkpointEvery(final int theCheckpointEvery) {
      if (theCheckpointEvery <= 0) {
        throw new IllegalArgumentException(
            "checkpointEvery must be greater than 0, got: "
                + theCheckpointEvery);
      }
      checkpointEvery = theCheckpointEvery;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the options, never null
     */
    public AnalysisOptions build() {
      return new AnalysisOptions(this);
    }
  }
}
