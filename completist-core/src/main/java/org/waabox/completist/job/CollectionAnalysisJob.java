package org.waabox.completist.job;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.analysis.CollectionCompletenessAnalyzer;
import org.waabox.completist.analysis.CollectionUnit;
import org.waabox.completist.catalog.CatalogMovie;
import org.waabox.completist.catalog.VideoCatalog;
import org.waabox.completist.dedup.Deduplicator;
import org.waabox.completist.model.CollectionCompleteness;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.Scope;
import org.waabox.completist.store.LibraryStore;
import org.waabox.completist.store.OwnedItemFilter;

/**
 * Analyzes every movie collection that owned movies belong to.
 *
 * <p>Phases: {@code scanning}, where owned movies get their catalog ids
 * and are looked up to learn which collection they belong to;
 * {@code fetching}, where each collection is diffed against the catalog;
 * and {@code complete}. Collections with at most one released member are
 * not stored.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CollectionAnalysisJob extends AnalysisJob {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CollectionAnalysisJob.class);

  /** The job name, also the domain reported to metrics. */
  public static final String NAME = "collections";

  /** The domain reported to metrics for the scanning phase. */
  private static final String SCAN_DOMAIN = "collection-scan";

  /** The video catalog, never null. */
  private final VideoCatalog catalog;

  /** The deduplicator, never null. */
  private final Deduplicator deduplicator;

  /** The collection analyzer, never null. */
  private final CollectionCompletenessAnalyzer analyzer;

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
   * @param theAnalyzer     the collection analyzer, never null
   * @param theStore        the library store, never null
   * @param theRunner       the batch runner, never null
   * @param theClock        the clock, never null
   * @param runSlot         the slot shared by jobs that cannot overlap,
   *                        never null
   */
  public CollectionAnalysisJob(final VideoCatalog theCatalog,
      final Deduplicator theDeduplicator,
      final CollectionCompletenessAnalyzer theAnalyzer,
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

    final List<OwnedItem> owned = store.ownedItems(
        OwnedItemFilter.movies(scope));
    final List<OwnedItem> movies = options.deduplicate(scope)
        ? deduplicator.movies(owned, token, listener)
        : deduplicator.resolveMovies(owned, token, listener);

    final List<OwnedItem> matched = movies.stream()
        .filter(OwnedItem::hasCatalogId)
        .toList();

    final Map<String, List<OwnedItem>> byCollection =
        new ConcurrentSkipListMap<>();

    final BatchOutcome scan = runner.run(SCAN_DOMAIN, Phases.SCANNING,
        matched, new UnitTask<>() {
          @Override
          public String describe(final OwnedItem unit) {
            return unit.title();
          }

          @Override
          public void process(final OwnedItem unit) {
            final CatalogMovie movie = catalog.movie(unit.catalogId());
            if (movie.collectionId() != null) {
              byCollection.computeIfAbsent(movie.collectionId(),
                  id -> Collections.synchronizedList(new ArrayList<>()))
                  .add(unit);
            }
          }
        }, AnalysisOptions.builder()
            .skipRecentlyAnalyzed(false)
            .concurrency(options.concurrency())
            .checkpointEvery(Integer.MAX_VALUE)
            .build(), token, listener);

    if (scan.cancelled()) {
      return new AnalysisResult(false, 0, 0);
    }

    log.info("Found {} collections among {} owned movies",
        byCollection.size(), matched.size());

    final List<CollectionUnit> units = new ArrayList<>();
    byCollection.forEach((id, members) ->
        units.add(new CollectionUnit(id, scope, members)));

    final BatchOutcome outcome = runner.run(NAME, Phases.FETCHING, units,
        new UnitTask<>() {
          @Override
          public String describe(final CollectionUnit unit) {
            return unit.collectionId();
          }

          @Override
          public boolean isFresh(final CollectionUnit unit) {
            final Optional<CollectionCompleteness> previous = store.record(
                CollectionCompleteness.class, unit.collectionId(), scope);
            return previous.isPresent()
                && options.isFresh(previous.get().updatedAt(), clock.instant())
                && previous.get().ownedItemCount()
                    == unit.ownedMovies().size();
          }

          @Override
          public void process(final CollectionUnit unit) {
            analyzer.analyze(unit).ifPresent(store::upsert);
          }
        }, options, token, listener);

    return Phases.finish(outcome, units.size(), listener);
  }
}
