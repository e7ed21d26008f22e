package org.waabox.completist.analysis;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.model.CompletenessRecord;

/**
 * The completeness analysis shared by every domain.
 *
 * <p>{@link #analyze(Object)} resolves the catalog id of the unit. When
 * the unit cannot be matched it returns {@link #unmatched(Object)}, which
 * flags the unit for manual matching rather than failing. Otherwise it
 * delegates to {@link #compute(Object, String)}, which fetches the catalog
 * structure, applies the domain's inclusion rules and diffs it against
 * what is owned. Catalog failures during the fetch propagate to the
 * caller.
 *
 * <p>Analyzers are stateless and can be shared by concurrent runs.
 *
 * @param <U> the unit type
 * @param <R> the record type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public abstract class AbstractCompletenessAnalyzer<U,
    R extends CompletenessRecord> {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      AbstractCompletenessAnalyzer.class);

  /** The release date rules, never null. */
  private final ReleaseDates releaseDates;

  /**
   * Creates a new analyzer.
   *
   * @param clock the clock that defines today, never null
   */
  protected AbstractCompletenessAnalyzer(final Clock clock) {
    releaseDates = new ReleaseDates(clock);
  }

  /**
   * Analyzes one unit.
   *
   * @param unit the unit, never null
   * @return the record, or empty if the unit must not be tracked
   *
   * @throws org.waabox.completist.http.CatalogException if fetching the
   *         catalog structure fails
   */
  public final Optional<R> analyze(final U unit) {
    Objects.requireNonNull(unit, "unit must not be null");
    final Optional<String> catalogId = resolveId(unit);
    if (catalogId.isEmpty()) {
      log.info("No catalog match for {}, flagging it as unmatched",
          describe(unit));
      return unmatched(unit);
    }
    return compute(unit, catalogId.get());
  }

  /**
   * Describes a unit for logs.
   *
   * @param unit the unit, never null
   * @return the description, never null
   */
  public abstract String describe(U unit);

  /**
   * Resolves the catalog id of a unit, using a cached id when there is
   * one. Lookup failures must be logged and reported as empty.
   *
   * @param unit the unit, never null
   * @return the catalog id, or empty if unresolved
   */
  protected abstract Optional<String> resolveId(U unit);

  /**
   * Builds the result for a unit that could not be matched.
   *
   * @param unit the unit, never null
   * @return the unmatched record, or empty if unmatched units are not
   *         tracked
   */
  protected abstract Optional<R> unmatched(U unit);

  /**
   * Fetches the catalog structure and diffs it against the owned items.
   *
   * @param unit      the unit, never null
   * @param catalogId the resolved catalog id, never null
   * @return the record, or empty if the unit must not be tracked
   */
  protected abstract Optional<R> compute(U unit, String catalogId);

  /**
   * Runs a write-back of artwork, logging and swallowing any failure.
   *
   * @param description what is being updated, for logs
   * @param update      the update, never null
   */
  protected final void pushArtwork(final String description,
      final Runnable update) {
    try {
      update.run();
    } catch (final RuntimeException e) {
      log.warn("Could not update artwork of {}: {}", description,
          e.getMessage());
    }
  }

  /**
   * Returns the release date rules.
   *
   * @return the rules, never null
   */
  protected final ReleaseDates releaseDates() {
    return releaseDates;
  }

  /**
   * Returns the current instant, used to stamp records.
   *
   * @return now, never null
   */
  protected final Instant now() {
    return releaseDates.clock().instant();
  }
}
