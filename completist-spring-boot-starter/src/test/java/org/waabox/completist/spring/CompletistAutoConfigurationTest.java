package org.waabox.completist.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.completist.Completist;
import org.waabox.completist.catalog.MusicCatalog;
import org.waabox.completist.catalog.VideoCatalog;
import org.waabox.completist.job.AnalysisOptions;
import org.waabox.completist.job.ProgressListener;
import org.waabox.completist.metrics.CompletistMetrics;
import org.waabox.completist.metrics.NoopCompletistMetrics;
import org.waabox.completist.model.Scope;
import org.waabox.completist.musicbrainz.MusicBrainzCatalog;
import org.waabox.completist.store.InMemoryLibraryStore;
import org.waabox.completist.store.LibraryStore;
import org.waabox.completist.store.fs.FileSystemLibraryStore;
import org.waabox.completist.tmdb.TmdbCatalog;

/**
 * Tests for {@link CompletistAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} to check the wiring without
 * bootstrapping a full Spring Boot application. No test reaches the real
 * catalogs.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CompletistAutoConfigurationTest {

  /** The application context runner configured with the auto-configuration. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(
          AutoConfigurations.of(CompletistAutoConfiguration.class));

  @Test
  void whenContextLoads_givenNoProperties_shouldUseDefaults() {
    runner.run(context -> {
      // Arrange
      final Completist completist = context.getBean(Completist.class);

      // Act
      final AnalysisOptions options = completist.defaultOptions();

      // Assert
      assertInstanceOf(InMemoryLibraryStore.class,
          context.getBean(LibraryStore.class));
      assertInstanceOf(TmdbCatalog.class,
          context.getBean(VideoCatalog.class));
      assertFalse(context.containsBean("completistMusicCatalog"));

      assertTrue(options.skipRecentlyAnalyzed());
      assertEquals(7, options.reanalyzeAfterDays());
      assertEquals(5, options.concurrency());
      assertEquals(25, options.checkpointEvery());
    });
  }

  @Test
  void whenContextLoads_givenNoUserAgent_shouldLeaveMusicUnconfigured() {
    runner.run(context -> {
      final Completist completist = context.getBean(Completist.class);

      final IllegalStateException e = assertThrows(
          IllegalStateException.class, () -> completist.analyzeAllMusic(
              Scope.all(), ProgressListener.none()));

      assertEquals("No music catalog configured", e.getMessage());
    });
  }

  @Test
  void whenContextLoads_givenUserAgent_shouldCreateMusicCatalog() {
    runner.withPropertyValues(
        "completist.musicbrainz.user-agent=Completist/1.0 (ops@example.org)")
        .run(context -> assertInstanceOf(MusicBrainzCatalog.class,
            context.getBean(MusicCatalog.class)));
  }

  @Test
  void whenContextLoads_givenTmdbDisabled_shouldLeaveVideoUnconfigured() {
    runner.withPropertyValues("completist.tmdb.enabled=false")
        .run(context -> {
          assertFalse(context.containsBean("completistVideoCatalog"));

          final Completist completist = context.getBean(Completist.class);
          final IllegalStateException e = assertThrows(
              IllegalStateException.class, () -> completist.analyzeAllSeries(
                  Scope.all(), ProgressListener.none()));
          assertEquals("No video catalog configured", e.getMessage());
        });
  }

  @Test
  void whenContextLoads_givenStoreDirectory_shouldUseFileSystemStore(
      @TempDir final Path tempDir) {
    runner.withPropertyValues("completist.store.directory=" + tempDir)
        .run(context -> {
          final LibraryStore store = context.getBean(LibraryStore.class);
          assertInstanceOf(FileSystemLibraryStore.class, store);

          store.putSetting("tmdb_api_key", "from-store");

          assertTrue(Files.exists(tempDir.resolve("library.json")));
        });
  }

  @Test
  void whenContextLoads_givenAnalysisProperties_shouldBindThem() {
    runner.withPropertyValues(
        "completist.analysis.concurrency=2",
        "completist.analysis.reanalyze-after-days=30",
        "completist.analysis.skip-recently-analyzed=false",
        "completist.analysis.filter-vinyl-only=true",
        "completist.analysis.checkpoint-every=10")
        .run(context -> {
          final AnalysisOptions options = context.getBean(Completist.class)
              .defaultOptions();
          assertEquals(2, options.concurrency());
          assertEquals(30, options.reanalyzeAfterDays());
          assertFalse(options.skipRecentlyAnalyzed());
          assertTrue(options.filterVinylOnly());
          assertEquals(10, options.checkpointEvery());
        });
  }

  @Test
  void whenContextLoads_givenCustomStore_shouldUseIt() {
    runner.withUserConfiguration(TestStoreConfig.class)
        .run(context -> {
          final LibraryStore store = context.getBean(LibraryStore.class);
          assertSame(TestStoreConfig.STORE, store);
          assertEquals("custom", store.setting("marker").orElseThrow());
        });
  }

  @Test
  void whenContextLoads_givenCustomMetrics_shouldWireThem() {
    runner.withUserConfiguration(TestMetricsConfig.class)
        .run(context -> {
          assertTrue(context.getBean(CompletistMetrics.class)
              instanceof CustomMetrics);
          assertTrue(context.containsBean("completist"));
        });
  }

  @Test
  void whenContextCloses_shouldStopCompletist() {
    runner.run(context -> {
      final SmartLifecycle lifecycle = context.getBean("completistLifecycle",
          SmartLifecycle.class);
      assertTrue(lifecycle.isRunning());
      assertEquals(Integer.MAX_VALUE - 1, lifecycle.getPhase());

      context.close();

      assertFalse(lifecycle.isRunning());
    });
  }

  /** Provides a pre-populated store. */
  @Configuration(proxyBeanMethods = false)
  static class TestStoreConfig {

    static final InMemoryLibraryStore STORE = new InMemoryLibraryStore();

    @Bean
    LibraryStore testLibraryStore() {
      STORE.putSetting("marker", "custom");
      return STORE;
    }
  }

  /** Provides a metrics implementation. */
  @Configuration(proxyBeanMethods = false)
  static class TestMetricsConfig {

    @Bean
    CompletistMetrics testMetrics() {
      return new CustomMetrics();
    }
  }

  /** A metrics implementation the auto-configuration must not replace. */
  static class CustomMetrics extends NoopCompletistMetrics {
  }
}
