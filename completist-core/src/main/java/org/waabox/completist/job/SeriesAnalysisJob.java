package org.waabox.completist.job;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.waabox.completist.analysis.SeriesCompletenessAnalyzer;
import org.waabox.completist.catalog.VideoCatalog;
import org.waabox.completist.dedup.Deduplicator;
import org.waabox.completist.dedup.SeriesGroup;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.Scope;
import org.waabox.completist.model.SeriesCompleteness;
import org.waabox.completist.store.LibraryStore;
import org.waabox.completist.store.OwnedItemFilter;

/**
 * Analyzes every owned series in a scope.
 *
 * <p>Phases: {@code scanning}, where owned episodes are grouped into
 * series and deduplicated across providers when asked to;
 * {@code analyzing}, where each series is diffed against the catalog; and
 * {@code complete}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SeriesAnalysisJob extends AnalysisJob {

  /** The job name, also the domain reported to metrics. */
  public static final String NAME = "series";

  /** The video catalog, never null. */
  private final VideoCatalog catalog;

  /** The deduplicator, never null. */
  private final Deduplicator deduplicator;

  /** The series analyzer, never null. */
  private final SeriesCompletenessAnalyzer analyzer;

  /** The library store, never null. */
  private final LibraryStore store;

  /** The batch runner, never null. */
  private final BatchJobRunner runner;

  /** The clock used by the freshness check, never null. */
  private final Clock clock;

  /**
   * Creates a new job.
   *
   * @param theCatalog      the video catalog, never null
   * @param theDeduplicator the deduplicator, never null
   * @param theAnalyzer     the series analyzer, never null
   * @param theStore        the library store, never null
   * @param theRunner       the batch runner, never null
   * @param theClock        the clock, never null
   * @param runSlot         the slot shared by jobs that cannot overlap,
   *                        never null
   */
  public SeriesAnalysisJob(final VideoCatalog theCatalog,
      final Deduplicator theDeduplicator,
      final SeriesCompletenessAnalyzer theAnalyzer,
      final LibraryStore theStore, final BatchJobRunner theRunner,
      final Clock theClock, final AtomicReference<String> runSlot) {
    super(NAME, theStore, runSlot);
    catalog = Objects.requireNonNull(theCatalog, "catalog must not be null");
    deduplicator = Objects.requireNonNull(theDeduplicator,
        "deduplicator must not be null");
    analyzer = Objects.requireNonNull(theAnalyzer,
        "analyzer must not be null");
    store = Objects.requireNonNull(theStore, "store must not be null");
    runner = Objects.requireNonNull(theRunner, "runner must not be null");
    clock = Objects.requireNonNull(theClock, "clock must not be null");
  }

  /** {@inheritDoc} */
  @Override
  protected void verifyPreconditions() {
    catalog.verifyCredentials();
  }

  /** {@inheritDoc} */
  @Override
  protected AnalysisResult execute(final Scope scope,
      final AnalysisOptions options, final CancellationToken token,
      final ProgressListener listener) {

    listener.onProgress(new AnalysisProgress(0, 0, "Loading owned episodes",
        Phases.SCANNING, 0));

    final List<OwnedItem> episodes = store.ownedItems(
        OwnedItemFilter.episodes(scope));
    final List<SeriesGroup> series = options.deduplicate(scope)
        ? deduplicator.series(episodes, scope, token, listener)
        : Deduplicator.groupByTitle(episodes, scope);

    if (token.isCancelled()) {
      return new AnalysisResult(false, 0, 0);
    }

    final BatchOutcome outcome = runner.run(NAME, Phases.ANALYZING, series,
        new UnitTask<>() {
          @Override
          public String describe(final SeriesGroup unit) {
            return unit.title();
          }

          @Override
          public boolean isFresh(final SeriesGroup unit) {
            final Optional<SeriesCompleteness> previous = store.record(
                SeriesCompleteness.class, unit.title(), scope);
            return previous.isPresent()
                && options.isFresh(previous.get().updatedAt(), clock.instant())
                && previous.get().ownedItemCount() == unit.episodes().size();
          }

          @Override
          public void process(final SeriesGroup unit) {
            analyzer.analyze(unit).ifPresent(store::upsert);
          }
        }, options, token, listener);

    return Phases.finish(outcome, series.size(), listener);
  }
}
