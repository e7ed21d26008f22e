package org.waabox.completist.spring;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.completist.Completist;
import org.waabox.completist.catalog.MusicCatalog;
import org.waabox.completist.catalog.VideoCatalog;
import org.waabox.completist.job.AnalysisOptions;
import org.waabox.completist.metrics.CompletistMetrics;
import org.waabox.completist.metrics.NoopCompletistMetrics;
import org.waabox.completist.musicbrainz.MusicBrainzCatalog;
import org.waabox.completist.musicbrainz.MusicBrainzConfig;
import org.waabox.completist.store.InMemoryLibraryStore;
import org.waabox.completist.store.LibraryStore;
import org.waabox.completist.store.fs.FileSystemLibraryStore;
import org.waabox.completist.tmdb.TmdbCatalog;
import org.waabox.completist.tmdb.TmdbConfig;

/**
 * Spring Boot auto-configuration for Completist.
 *
 * <p>Creates a singleton {@link Completist} wired to a library store, the
 * TMDB catalog and, when a MusicBrainz user agent is configured, the
 * MusicBrainz catalog. Each of these, as well as the default
 * {@link AnalysisOptions}, can be replaced by declaring a bean of the same
 * type. A {@link CompletistMetrics} bean is picked up when present.
 *
 * <p>On shutdown running analyses are cancelled and the workers are
 * stopped through a {@link SmartLifecycle}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(CompletistProperties.class)
public class CompletistAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CompletistAutoConfiguration.class);

  /**
   * Creates the library store: file backed when a directory is configured,
   * in memory otherwise.
   *
   * @param properties the configuration properties, never null
   *
   * @return the store, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public LibraryStore completistLibraryStore(
      final CompletistProperties properties) {
    final String directory = properties.getStore().getDirectory();
    if (directory == null || directory.isBlank()) {
      log.warn("completist.store.directory is not set, the library will"
          + " not survive a restart");
      return new InMemoryLibraryStore();
    }
    log.info("Completist library stored under {}", directory);
    return new FileSystemLibraryStore(Path.of(directory));
  }

  /**
   * Creates the TMDB catalog.
   *
   * @param properties      the configuration properties, never null
   * @param store           the store holding the api key setting, never null
   * @param metricsProvider provider for an optional CompletistMetrics bean
   *
   * @return the catalog, never null
   */
  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "completist.tmdb", name = "enabled",
      matchIfMissing = true)
  public VideoCatalog completistVideoCatalog(
      final CompletistProperties properties, final LibraryStore store,
      final ObjectProvider<CompletistMetrics> metricsProvider) {
    final CompletistProperties.Tmdb tmdb = properties.getTmdb();
    final TmdbConfig.Builder config = TmdbConfig.builder()
        .apiKey(tmdb.getApiKey());
    if (tmdb.getBaseUrl() != null) {
      config.baseUrl(tmdb.getBaseUrl());
    }
    return new TmdbCatalog(config.build(), store,
        metricsProvider.getIfAvailable(NoopCompletistMetrics::new));
  }

  /**
   * Creates the MusicBrainz catalog.
   *
   * @param properties      the configuration properties, never null
   * @param metricsProvider provider for an optional CompletistMetrics bean
   *
   * @return the catalog, never null
   */
  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "completist.musicbrainz",
      name = "user-agent")
  public MusicCatalog completistMusicCatalog(
      final CompletistProperties properties,
      final ObjectProvider<CompletistMetrics> metricsProvider) {
    final CompletistProperties.MusicBrainz musicbrainz =
        properties.getMusicbrainz();
    final MusicBrainzConfig.Builder config = MusicBrainzConfig.builder(
        musicbrainz.getUserAgent());
    if (musicbrainz.getBaseUrl() != null) {
      config.baseUrl(musicbrainz.getBaseUrl());
    }
    return new MusicBrainzCatalog(config.build(),
        metricsProvider.getIfAvailable(NoopCompletistMetrics::new));
  }

  /**
   * Creates the default analysis options.
   *
   * @param properties the configuration properties, never null
   *
   * @return the options, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public AnalysisOptions completistAnalysisOptions(
      final CompletistProperties properties) {
    final CompletistProperties.Analysis analysis = properties.getAnalysis();
    return AnalysisOptions.builder()
        .skipRecentlyAnalyzed(analysis.isSkipRecentlyAnalyzed())
        .reanalyzeAfterDays(analysis.getReanalyzeAfterDays())
        .filterVinylOnly(analysis.isFilterVinylOnly())
        .concurrency(analysis.getConcurrency())
        .checkpointEvery(analysis.getCheckpointEvery())
        .build();
  }

  /**
   * Creates the singleton {@link Completist} bean.
   *
   * @param store                the library store, never null
   * @param options              the default analysis options, never null
   * @param videoCatalogProvider provider for an optional VideoCatalog bean
   * @param musicCatalogProvider provider for an optional MusicCatalog bean
   * @param metricsProvider      provider for an optional
   *                             CompletistMetrics bean
   *
   * @return the configured instance, never null
   */
  @Bean
  public Completist completist(
      final LibraryStore store,
      final AnalysisOptions options,
      final ObjectProvider<VideoCatalog> videoCatalogProvider,
      final ObjectProvider<MusicCatalog> musicCatalogProvider,
      final ObjectProvider<CompletistMetrics> metricsProvider) {

    final Completist.Builder builder = Completist.builder()
        .store(store)
        .defaultOptions(options);

    videoCatalogProvider.ifAvailable(catalog -> {
      builder.videoCatalog(catalog);
      log.info("Completist using VideoCatalog: {}",
          catalog.getClass().getSimpleName());
    });

    musicCatalogProvider.ifAvailable(catalog -> {
      builder.musicCatalog(catalog);
      log.info("Completist using MusicCatalog: {}",
          catalog.getClass().getSimpleName());
    });

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Completist using custom CompletistMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    return builder.build();
  }

  /**
   * Creates a {@link SmartLifecycle} bean that stops Completist on
   * shutdown.
   *
   * <p>The lifecycle stops early (phase {@code Integer.MAX_VALUE - 1}) so
   * running analyses are cancelled before the beans they use go away.
   *
   * @param completist the instance to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle completistLifecycle(final Completist completist) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        running = true;
        log.info("Completist ready");
      }

      @Override
      public void stop() {
        log.info("Stopping Completist...");
        completist.stop();
        running = false;
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }
}
