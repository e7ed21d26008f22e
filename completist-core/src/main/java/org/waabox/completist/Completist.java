package org.waabox.completist;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.analysis.AlbumTrackAnalyzer;
import org.waabox.completist.analysis.AlbumUnit;
import org.waabox.completist.analysis.ArtistUnit;
import org.waabox.completist.analysis.CollectionCompletenessAnalyzer;
import org.waabox.completist.analysis.CollectionUnit;
import org.waabox.completist.analysis.DiscographyAnalyzer;
import org.waabox.completist.analysis.SeriesCompletenessAnalyzer;
import org.waabox.completist.catalog.CatalogMovie;
import org.waabox.completist.catalog.MusicCatalog;
import org.waabox.completist.catalog.VideoCatalog;
import org.waabox.completist.dedup.CatalogIdResolver;
import org.waabox.completist.dedup.Deduplicator;
import org.waabox.completist.dedup.SeriesGroup;
import org.waabox.completist.job.AnalysisJob;
import org.waabox.completist.job.AnalysisOptions;
import org.waabox.completist.job.AnalysisResult;
import org.waabox.completist.job.BatchJobRunner;
import org.waabox.completist.job.CollectionAnalysisJob;
import org.waabox.completist.job.JobState;
import org.waabox.completist.job.MusicAnalysisJob;
import org.waabox.completist.job.ProgressListener;
import org.waabox.completist.job.SeriesAnalysisJob;
import org.waabox.completist.metrics.CompletistMetrics;
import org.waabox.completist.metrics.NoopCompletistMetrics;
import org.waabox.completist.model.AlbumCompleteness;
import org.waabox.completist.model.ArtistCompleteness;
import org.waabox.completist.model.CollectionCompleteness;
import org.waabox.completist.model.CompletenessRecord;
import org.waabox.completist.model.CompletenessStats;
import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.MusicArtist;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.Scope;
import org.waabox.completist.model.SeriesCompleteness;
import org.waabox.completist.store.LibraryStore;
import org.waabox.completist.store.OwnedItemFilter;

/**
 * Entry point of the completeness engine.
 *
 * <p>Completist wires the catalogs, the library store, the analyzers and
 * the batch jobs together. It runs batch analyses per domain, analyzes
 * single units on demand and exposes the stored records and their stats.
 *
 * <p>Batch runs of different domains share the store's write batch and so
 * never overlap: starting a run while another one is active throws
 * {@link AnalysisInProgressException}. Runs are synchronous; callers that
 * need them in the background submit them to their own executor.
 *
 * <p>Usage:
 * <pre>{@code
 * Completist completist = Completist.builder()
 *     .store(store)
 *     .videoCatalog(tmdb)
 *     .musicCatalog(musicBrainz)
 *     .build();
 *
 * AnalysisResult result = completist.analyzeAllSeries(Scope.all(),
 *     progress -> log.info("{}%", progress.percentage()));
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Completist {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Completist.class);

  /** The number of worker threads of the default executor. */
  private static final int DEFAULT_WORKERS = 10;

  /** The library store, never null. */
  private final LibraryStore store;

  /** The video catalog, null if video analysis is disabled. */
  private final VideoCatalog videoCatalog;

  /** The music catalog, null if music analysis is disabled. */
  private final MusicCatalog musicCatalog;

  /** The default run options, never null. */
  private final AnalysisOptions defaultOptions;

  /** The executor running the units, never null. */
  private final ExecutorService executor;

  /** Whether the executor was created here and must be shut down here. */
  private final boolean ownsExecutor;

  /** The series analyzer, null without a video catalog. */
  private final SeriesCompletenessAnalyzer seriesAnalyzer;

  /** The collection analyzer, null without a video catalog. */
  private final CollectionCompletenessAnalyzer collectionAnalyzer;

  /** The discography analyzer, null without a music catalog. */
  private final DiscographyAnalyzer discographyAnalyzer;

  /** The album analyzer, null without a music catalog. */
  private final AlbumTrackAnalyzer albumAnalyzer;

  /** The series job, null without a video catalog. */
  private final SeriesAnalysisJob seriesJob;

  /** The collection job, null without a video catalog. */
  private final CollectionAnalysisJob collectionJob;

  /** The music job, null without a music catalog. */
  private final MusicAnalysisJob musicJob;

  /** Whether {@link #stop()} was called. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /**
   * Creates a new Completist instance.
   *
   * @param theStore          the library store, never null
   * @param theVideoCatalog   the video catalog, may be null
   * @param theMusicCatalog   the music catalog, may be null
   * @param theMetrics        the metrics reporter, never null
   * @param clock             the clock, never null
   * @param theExecutor       the executor running the units, never null
   * @param theOwnsExecutor   whether the executor is shut down on stop
   * @param theDefaultOptions the default run options, never null
   */
  private Completist(final LibraryStore theStore,
      final VideoCatalog theVideoCatalog, final MusicCatalog theMusicCatalog,
      final CompletistMetrics theMetrics, final Clock clock,
      final ExecutorService theExecutor, final boolean theOwnsExecutor,
      final AnalysisOptions theDefaultOptions) {
    store = theStore;
    videoCatalog = theVideoCatalog;
    musicCatalog = theMusicCatalog;
    executor = theExecutor;
    ownsExecutor = theOwnsExecutor;
    defaultOptions = theDefaultOptions;

    final BatchJobRunner runner = new BatchJobRunner(store, executor,
        theMetrics);
    final AtomicReference<String> runSlot = new AtomicReference<>();

    if (videoCatalog != null) {
      final CatalogIdResolver resolver = new CatalogIdResolver(videoCatalog);
      final Deduplicator deduplicator = new Deduplicator(resolver, store);
      seriesAnalyzer = new SeriesCompletenessAnalyzer(videoCatalog, resolver,
          store, clock);
      collectionAnalyzer = new CollectionCompletenessAnalyzer(videoCatalog,
          store, clock);
      seriesJob = new SeriesAnalysisJob(videoCatalog, deduplicator,
          seriesAnalyzer, store, runner, clock, runSlot);
      collectionJob = new CollectionAnalysisJob(videoCatalog, deduplicator,
          collectionAnalyzer, store, runner, clock, runSlot);
    } else {
      seriesAnalyzer = null;
      collectionAnalyzer = null;
      seriesJob = null;
      collectionJob = null;
    }

    if (musicCatalog != null) {
      discographyAnalyzer = new DiscographyAnalyzer(musicCatalog, store,
          clock);
      albumAnalyzer = new AlbumTrackAnalyzer(musicCatalog, store, clock);
      musicJob = new MusicAnalysisJob(musicCatalog, discographyAnalyzer,
          albumAnalyzer, store, runner, clock, runSlot);
    } else {
      discographyAnalyzer = null;
      albumAnalyzer = null;
      musicJob = null;
    }
  }

  /**
   * Creates a new builder for constructing a Completist instance.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  // -----------------------------------------------------------------------
  // Batch runs
  // -----------------------------------------------------------------------

  /**
   * Analyzes every owned series in the scope with the default options.
   *
   * @param scope    the scope, never null
   * @param listener the progress listener, never null
   * @return the run result, never null
   *
   * @throws AnalysisInProgressException if another run is active
   * @throws MissingCredentialsException if the video catalog has no
   *         credentials
   */
  public AnalysisResult analyzeAllSeries(final Scope scope,
      final ProgressListener listener) {
    return analyzeAllSeries(scope, defaultOptions, listener);
  }

  /**
   * Analyzes every owned series in the scope.
   *
   * @param scope    the scope, never null
   * @param options  the run options, never null
   * @param listener the progress listener, never null
   * @return the run result, never null
   *
   * @throws AnalysisInProgressException if another run is active
   * @throws MissingCredentialsException if the video catalog has no
   *         credentials
   */
  public AnalysisResult analyzeAllSeries(final Scope scope,
      final AnalysisOptions options, final ProgressListener listener) {
    return requireVideo(seriesJob).run(scope, options, listener);
  }

  /**
   * Analyzes every movie collection in the scope with the default options.
   *
   * @param scope    the scope, never null
   * @param listener the progress listener, never null
   * @return the run result, never null
   */
  public AnalysisResult analyzeAllCollections(final Scope scope,
      final ProgressListener listener) {
    return analyzeAllCollections(scope, defaultOptions, listener);
  }

  /**
   * Analyzes every movie collection in the scope.
   *
   * @param scope    the scope, never null
   * @param options  the run options, never null
   * @param listener the progress listener, never null
   * @return the run result, never null
   */
  public AnalysisResult analyzeAllCollections(final Scope scope,
      final AnalysisOptions options, final ProgressListener listener) {
    return requireVideo(collectionJob).run(scope, options, listener);
  }

  /**
   * Analyzes every artist and album in the scope with the default options.
   *
   * @param scope    the scope, never null
   * @param listener the progress listener, never null
   * @return the run result, never null
   */
  public AnalysisResult analyzeAllMusic(final Scope scope,
      final ProgressListener listener) {
    return analyzeAllMusic(scope, defaultOptions, listener);
  }

  /**
   * Analyzes every artist and album in the scope.
   *
   * @param scope    the scope, never null
   * @param options  the run options, never null
   * @param listener the progress listener, never null
   * @return the run result, never null
   */
  public AnalysisResult analyzeAllMusic(final Scope scope,
      final AnalysisOptions options, final ProgressListener listener) {
    return requireMusic(musicJob).run(scope, options, listener);
  }

  // -----------------------------------------------------------------------
  // Single units
  // -----------------------------------------------------------------------

  /**
   * Analyzes one series and stores its record.
   *
   * @param seriesTitle the series title, never null
   * @param scope       the scope, never null
   * @return the stored record, or empty if nothing is owned
   */
  public Optional<SeriesCompleteness> analyzeSeries(final String seriesTitle,
      final Scope scope) {
    Objects.requireNonNull(seriesTitle, "seriesTitle must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    requireVideo(seriesAnalyzer);
    videoCatalog.verifyCredentials();

    final List<OwnedItem> episodes = store.ownedItems(
        OwnedItemFilter.episodesOf(seriesTitle, scope));
    final List<SeriesGroup> groups = Deduplicator.groupByTitle(episodes,
        scope);
    if (groups.isEmpty()) {
      log.debug("No owned episodes of '{}' in scope {}", seriesTitle,
          scope.key());
      return Optional.empty();
    }
    return storeResult(seriesAnalyzer.analyze(groups.get(0)));
  }

  /**
   * Analyzes one movie collection and stores its record.
   *
   * @param collectionId the collection catalog id, never null
   * @param scope        the scope, never null
   * @return the stored record, or empty if the collection is not tracked
   */
  public Optional<CollectionCompleteness> analyzeCollection(
      final String collectionId, final Scope scope) {
    Objects.requireNonNull(collectionId, "collectionId must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    requireVideo(collectionAnalyzer);
    videoCatalog.verifyCredentials();

    final Set<String> members = videoCatalog.collection(collectionId).parts()
        .stream()
        .map(CatalogMovie::id)
        .collect(Collectors.toSet());
    final List<OwnedItem> owned = store.ownedItems(
        OwnedItemFilter.movies(scope)).stream()
        .filter(movie -> movie.hasCatalogId()
            && members.contains(movie.catalogId()))
        .toList();
    return storeResult(collectionAnalyzer.analyze(
        new CollectionUnit(collectionId, scope, owned)));
  }

  /**
   * Analyzes the discography of one owned artist and stores its record.
   *
   * @param artistId the local artist id, never null
   * @param scope    the scope, never null
   * @return the stored record, or empty if the artist is not owned
   */
  public Optional<ArtistCompleteness> analyzeArtist(final String artistId,
      final Scope scope) {
    Objects.requireNonNull(artistId, "artistId must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    requireMusic(discographyAnalyzer);
    musicCatalog.verifyCredentials();

    final Optional<MusicArtist> artist = store.artists(scope).stream()
        .filter(candidate -> candidate.id().equals(artistId))
        .findFirst();
    if (artist.isEmpty()) {
      log.debug("Artist {} is not owned in scope {}", artistId, scope.key());
      return Optional.empty();
    }
    return storeResult(discographyAnalyzer.analyze(
        new ArtistUnit(artist.get(),
            store.albumsOfArtist(artistId), scope,
            defaultOptions.filterVinylOnly())));
  }

  /**
   * Analyzes the tracks of one owned album and stores its record.
   *
   * @param albumId the local album id, never null
   * @param scope   the scope, never null
   * @return the stored record, or empty if the album is not owned or has
   *         no catalog tracklist
   */
  public Optional<AlbumCompleteness> analyzeAlbum(final String albumId,
      final Scope scope) {
    Objects.requireNonNull(albumId, "albumId must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    requireMusic(albumAnalyzer);
    musicCatalog.verifyCredentials();

    final Optional<MusicAlbum> album = store.albums(scope).stream()
        .filter(candidate -> candidate.id().equals(albumId))
        .findFirst();
    if (album.isEmpty()) {
      log.debug("Album {} is not owned in scope {}", albumId, scope.key());
      return Optional.empty();
    }
    return storeResult(albumAnalyzer.analyze(new AlbumUnit(album.get(),
        store.tracksOfAlbum(albumId), scope)));
  }

  // -----------------------------------------------------------------------
  // Cancellation and state
  // -----------------------------------------------------------------------

  /** Cancels the running series analysis, if any. */
  public void cancelSeries() {
    cancel(seriesJob);
  }

  /** Cancels the running collection analysis, if any. */
  public void cancelCollections() {
    cancel(collectionJob);
  }

  /** Cancels the running music analysis, if any. */
  public void cancelMusic() {
    cancel(musicJob);
  }

  /** Cancels every running analysis. */
  public void cancelAll() {
    cancelSeries();
    cancelCollections();
    cancelMusic();
  }

  /**
   * Returns the state of the series job.
   *
   * @return the state, IDLE when video analysis is disabled
   */
  public JobState seriesState() {
    return state(seriesJob);
  }

  /**
   * Returns the state of the collection job.
   *
   * @return the state, IDLE when video analysis is disabled
   */
  public JobState collectionsState() {
    return state(collectionJob);
  }

  /**
   * Returns the state of the music job.
   *
   * @return the state, IDLE when music analysis is disabled
   */
  public JobState musicState() {
    return state(musicJob);
  }

  // -----------------------------------------------------------------------
  // Stored records
  // -----------------------------------------------------------------------

  /**
   * Returns the stored series records of a scope.
   *
   * @param scope the scope, never null
   * @return the records, never null
   */
  public List<SeriesCompleteness> seriesRecords(final Scope scope) {
    return store.records(SeriesCompleteness.class, scope);
  }

  /**
   * Returns the stored series records below 100% of a scope.
   *
   * @param scope the scope, never null
   * @return the records, never null
   */
  public List<SeriesCompleteness> incompleteSeries(final Scope scope) {
    return incomplete(seriesRecords(scope));
  }

  /**
   * Returns the stored collection records of a scope.
   *
   * @param scope the scope, never null
   * @return the records, never null
   */
  public List<CollectionCompleteness> collectionRecords(final Scope scope) {
    return store.records(CollectionCompleteness.class, scope);
  }

  /**
   * Returns the stored collection records below 100% of a scope.
   *
   * @param scope the scope, never null
   * @return the records, never null
   */
  public List<CollectionCompleteness> incompleteCollections(
      final Scope scope) {
    return incomplete(collectionRecords(scope));
  }

  /**
   * Returns the stored discography records of a scope.
   *
   * @param scope the scope, never null
   * @return the records, never null
   */
  public List<ArtistCompleteness> artistRecords(final Scope scope) {
    return store.records(ArtistCompleteness.class, scope);
  }

  /**
   * Returns the stored album records of a scope.
   *
   * @param scope the scope, never null
   * @return the records, never null
   */
  public List<AlbumCompleteness> albumRecords(final Scope scope) {
    return store.records(AlbumCompleteness.class, scope);
  }

  /**
   * Returns the series stats of a scope.
   *
   * @param scope the scope, never null
   * @return the stats, never null
   */
  public CompletenessStats seriesStats(final Scope scope) {
    return CompletenessStats.of(seriesRecords(scope));
  }

  /**
   * Returns the collection stats of a scope.
   *
   * @param scope the scope, never null
   * @return the stats, never null
   */
  public CompletenessStats collectionStats(final Scope scope) {
    return CompletenessStats.of(collectionRecords(scope));
  }

  /**
   * Returns the discography stats of a scope.
   *
   * @param scope the scope, never null
   * @return the stats, never null
   */
  public CompletenessStats artistStats(final Scope scope) {
    return CompletenessStats.of(artistRecords(scope));
  }

  /**
   * Returns the album stats of a scope.
   *
   * @param scope the scope, never null
   * @return the stats, never null
   */
  public CompletenessStats albumStats(final Scope scope) {
    return CompletenessStats.of(albumRecords(scope));
  }

  /**
   * Returns the default run options.
   *
   * @return the options, never null
   */
  public AnalysisOptions defaultOptions() {
    return defaultOptions;
  }

  /**
   * Cancels every run and shuts down the executor if it was created by
   * the builder. Calling it twice has no effect.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    cancelAll();
    if (ownsExecutor) {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
          log.warn("Workers did not finish in time, forcing shutdown");
          executor.shutdownNow();
        }
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        executor.shutdownNow();
      }
    }
    log.info("Completist stopped");
  }

  /** Stores a result if there is one and returns it. */
  private <R extends CompletenessRecord> Optional<R> storeResult(
      final Optional<R> result) {
    result.ifPresent(store::upsert);
    return result;
  }

  /** Keeps the records below 100%. */
  private static <R extends CompletenessRecord> List<R> incomplete(
      final List<R> records) {
    return records.stream()
        .filter(record -> record.completenessPercentage() < 100)
        .toList();
  }

  /** Cancels a job if it exists. */
  private static void cancel(final AnalysisJob job) {
    if (job != null) {
      job.cancel();
    }
  }

  /** Returns the state of a job, IDLE if it does not exist. */
  private static JobState state(final AnalysisJob job) {
    return job == null ? JobState.IDLE : job.state();
  }

  /** Fails unless video analysis is configured. */
  private static <T> T requireVideo(final T component) {
    if (component == null) {
      throw new IllegalStateException("No video catalog configured");
    }
    return component;
  }

  /** Fails unless music analysis is configured. */
  private static <T> T requireMusic(final T component) {
    if (component == null) {
      throw new IllegalStateException("No music catalog configured");
    }
    return component;
  }

  /**
   * A fluent builder for {@link Completist}.
   *
   * <p>Only the store is required. Without a video catalog the series and
   * collection operations fail with {@link IllegalStateException}; the
   * same goes for music without a music catalog.
   */
  public static final class Builder {

    /** The library store. */
    private LibraryStore store;

    /** The optional video catalog. */
    private VideoCatalog videoCatalog;

    /** The optional music catalog. */
    private MusicCatalog musicCatalog;

    /** The optional metrics reporter. */
    private CompletistMetrics metrics;

    /** The optional clock. */
    private Clock clock;

    /** The optional executor. */
    private ExecutorService executor;

    /** The optional default run options. */
    private AnalysisOptions defaultOptions;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the library store.
     *
     * @param theStore the store, never null
     * @return this builder for chaining, never null
     */
    public Builder store(final LibraryStore theStore) {
      store = Objects.requireNonNull(theStore, "store must not be null");
      return this;
    }

    /**
     * Sets the video catalog used for series and collections.
     *
     * @param theCatalog the catalog, never null
     * @return this builder for chaining, never null
     */
    public Builder videoCatalog(final VideoCatalog theCatalog) {
      videoCatalog = Objects.requireNonNull(theCatalog,
          "videoCatalog must not be null");
      return this;
    }

    /**
     * Sets the music catalog used for discographies and albums.
     *
     * @param theCatalog the catalog, never null
     * @return this builder for chaining, never null
     */
    public Builder musicCatalog(final MusicCatalog theCatalog) {
      musicCatalog = Objects.requireNonNull(theCatalog,
          "musicCatalog must not be null");
      return this;
    }

    /**
     * Sets the metrics reporter. Defaults to
     * {@link NoopCompletistMetrics}.
     *
     * @param theMetrics the metrics reporter, never null
     * @return this builder for chaining, never null
     */
    public Builder metrics(final CompletistMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets the clock that defines today and stamps records. Defaults to
     * the system clock.
     *
     * @param theClock the clock, never null
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock must not be null");
      return this;
    }

    /**
     * Sets the executor running the units of a batch. The caller keeps
     * ownership and shuts it down. Defaults to a fixed pool of daemon
     * threads owned by the instance.
     *
     * @param theExecutor the executor, never null
     * @return this builder for chaining, never null
     */
    public Builder executor(final ExecutorService theExecutor) {
      executor = Objects.requireNonNull(theExecutor,
          "executor must not be null");
      return this;
    }

    /**
     * Sets the options used when a run is started without any. Defaults to
     * {@link AnalysisOptions#defaults()}.
     *
     * @param theOptions the options, never null
     * @return this builder for chaining, never null
     */
    public Builder defaultOptions(final AnalysisOptions theOptions) {
      defaultOptions = Objects.requireNonNull(theOptions,
          "defaultOptions must not be null");
      return this;
    }

    /**
     * Builds the Completist instance.
     *
     * @return a new instance, never null
     *
     * @throws IllegalStateException if no store was set
     */
    public Completist build() {
      if (store == null) {
        throw new IllegalStateException("store is required");
      }
      final boolean ownsExecutor = executor == null;
      final ExecutorService resolvedExecutor = ownsExecutor
          ? Executors.newFixedThreadPool(DEFAULT_WORKERS, workerFactory())
          : executor;

      return new Completist(
          store,
          videoCatalog,
          musicCatalog,
          metrics != null ? metrics : new NoopCompletistMetrics(),
          clock != null ? clock : Clock.systemUTC(),
          resolvedExecutor,
          ownsExecutor,
          defaultOptions != null ? defaultOptions : AnalysisOptions.defaults());
    }

    /** Creates daemon worker threads named completist-worker-N. */
    private static ThreadFactory workerFactory() {
      final AtomicInteger counter = new AtomicInteger();
      return runnable -> {
        final Thread thread = new Thread(runnable,
            "completist-worker-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      };
    }
  }
}
