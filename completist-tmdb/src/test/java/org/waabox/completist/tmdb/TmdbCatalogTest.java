package org.waabox.completist.tmdb;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.completist.MissingCredentialsException;
import org.waabox.completist.catalog.CatalogCollection;
import org.waabox.completist.catalog.CatalogMovie;
import org.waabox.completist.catalog.CatalogSearchResult;
import org.waabox.completist.catalog.CatalogSeason;
import org.waabox.completist.catalog.CatalogShow;
import org.waabox.completist.catalog.ExternalIdMatches;
import org.waabox.completist.catalog.ImageSize;
import org.waabox.completist.http.CatalogHttpClient;
import org.waabox.completist.http.CatalogHttpException;
import org.waabox.completist.metrics.NoopCompletistMetrics;
import org.waabox.completist.ratelimit.RateLimiters;
import org.waabox.completist.store.InMemoryLibraryStore;
import org.waabox.completist.store.LibraryStore;

/**
 * Tests for {@link TmdbCatalog}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TmdbCatalogTest {

  private TmdbStubServer server;

  private InMemoryLibraryStore store;

  private TmdbCatalog catalog;

  @BeforeEach
  void setUp() throws IOException {
    server = new TmdbStubServer();
    store = new InMemoryLibraryStore();
    catalog = catalog(TmdbConfig.builder()
        .baseUrl(server.baseUrl())
        .apiKey("secret")
        .build(), store);
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test
  void whenFetchingMovie_givenCollectionMembership_shouldMapEveryField() {
    // Arrange
    server.serve("/movie/603", fixture("movie-603.json"));

    // Act
    final CatalogMovie movie = catalog.movie("603");

    // Assert
    assertEquals("603", movie.id());
    assertEquals("The Matrix", movie.title());
    assertEquals(LocalDate.of(1999, 3, 30), movie.releaseDate());
    assertEquals(1999, movie.year());
    assertEquals("/matrix.jpg", movie.posterPath());
    assertEquals("2344", movie.collectionId());
    assertEquals("The Matrix Collection", movie.collectionName());
    assertEquals("secret", server.requests().get(0).params().get("api_key"));
  }

  @Test
  void whenFetchingMovie_givenEmptyReleaseDate_shouldLeaveItNull() {
    server.serve("/movie/1", fixture("movie-untitled.json"));

    final CatalogMovie movie = catalog.movie("1");

    assertNull(movie.releaseDate());
    assertNull(movie.year());
    assertNull(movie.posterPath());
    assertNull(movie.collectionId());
  }

  @Test
  void whenFetchingCollection_shouldTagPartsWithTheCollection() {
    server.serve("/collection/2344", fixture("collection-2344.json"));

    final CatalogCollection collection = catalog.collection("2344");

    assertEquals("The Matrix Collection", collection.name());
    assertEquals("/p.jpg", collection.posterPath());
    assertEquals("/b.jpg", collection.backdropPath());
    assertEquals(2, collection.parts().size());
    assertEquals("604", collection.parts().get(1).id());
    assertEquals("2344", collection.parts().get(1).collectionId());
    assertEquals("/r.jpg", collection.parts().get(1).posterPath());
  }

  @Test
  void whenFetchingShow_shouldMapSeasonSummaries() {
    server.serve("/tv/1396", fixture("tv-1396.json"));

    final CatalogShow show = catalog.show("1396");

    assertEquals("Breaking Bad", show.name());
    assertEquals("Ended", show.status());
    assertNull(show.backdropPath());
    assertEquals(2, show.seasons().size());
    assertEquals(0, show.seasons().get(0).seasonNumber());
    assertNull(show.seasons().get(0).airDate());
    assertEquals(7, show.seasons().get(1).episodeCount());
    assertEquals(LocalDate.of(2008, 1, 20), show.seasons().get(1).airDate());
  }

  @Test
  void whenFetchingSeasons_shouldAppendThemToOneShowRequest() {
    server.serve("/tv/1396", fixture("tv-1396-append.json"));

    final List<CatalogSeason> seasons = catalog.seasons("1396",
        List.of(1, 2));

    assertEquals(1, seasons.size());
    assertEquals(2, seasons.get(0).episodes().size());
    assertEquals("Pilot", seasons.get(0).episodes().get(0).name());
    assertEquals("/e1.jpg", seasons.get(0).episodes().get(0).stillPath());
    assertEquals(1, server.requests().size());
    assertEquals("season/1,season/2", server.requests().get(0).params()
        .get("append_to_response"));
  }

  @Test
  void whenFetchingSeasons_givenMoreThanTwenty_shouldRefuse() {
    final List<Integer> numbers = IntStream.rangeClosed(1, 21)
        .boxed().toList();

    assertThrows(IllegalArgumentException.class,
        () -> catalog.seasons("1396", numbers));
    assertTrue(server.requests().isEmpty());
  }

  @Test
  void whenFetchingSeasons_givenNone_shouldNotCallTheApi() {
    assertTrue(catalog.seasons("1396", List.of()).isEmpty());
    assertTrue(server.requests().isEmpty());
  }

  @Test
  void whenFetchingSeason_shouldUseTheSeasonEndpoint() {
    server.serve("/tv/1396/season/2", fixture("season-2.json"));

    final CatalogSeason season = catalog.season("1396", 2);

    assertEquals(2, season.seasonNumber());
    assertEquals(2, season.episodes().get(0).seasonNumber());
    assertNull(season.episodes().get(0).airDate());
  }

  @Test
  void whenSearchingMovies_givenYear_shouldSendItAndMapHits() {
    server.serve("/search/movie", fixture("search-movie.json"));

    final List<CatalogSearchResult> results = catalog.searchMovies(
        "The Matrix", 1999);

    assertEquals(2, results.size());
    assertEquals(new CatalogSearchResult("603", "The Matrix", 1999),
        results.get(0));
    assertNull(results.get(1).year());
    assertEquals("The Matrix", server.requests().get(0).params().get("query"));
    assertEquals("1999", server.requests().get(0).params().get("year"));
  }

  @Test
  void whenSearchingShows_shouldReadNameAndFirstAirDate() {
    server.serve("/search/tv", fixture("search-tv.json"));

    final List<CatalogSearchResult> results = catalog.searchShows(
        "Breaking Bad");

    assertEquals(new CatalogSearchResult("1396", "Breaking Bad", 2008),
        results.get(0));
  }

  @Test
  void whenFindingByImdbId_givenEpisodeResult_shouldReturnItsShow() {
    server.serve("/find/tt0959621", fixture("find-episode.json"));

    final ExternalIdMatches matches = catalog.findByImdbId("tt0959621");

    assertTrue(matches.movieIds().isEmpty());
    assertEquals(List.of("1396"), matches.showIds());
    assertEquals("imdb_id", server.requests().get(0).params()
        .get("external_source"));
  }

  @Test
  void whenFindingByImdbId_givenMovieAndShowResults_shouldListBoth() {
    server.serve("/find/tt0133093", fixture("find-movie-and-show.json"));

    final ExternalIdMatches matches = catalog.findByImdbId("tt0133093");

    assertEquals(List.of("603"), matches.movieIds());
    assertEquals(List.of("77"), matches.showIds());
  }

  @Test
  void whenFetchingTwice_shouldServeTheSecondFromCache() {
    server.serve("/movie/603", "{\"id\": 603, \"title\": \"The Matrix\"}");

    catalog.movie("603");
    catalog.movie("603");

    assertEquals(1, server.requests().size());
    assertEquals(1, catalog.cacheStats().size());

    catalog.clearCache();
    catalog.movie("603");
    assertEquals(2, server.requests().size());
  }

  @Test
  void whenFetching_givenUnknownId_shouldRaiseTheRemoteMessage() {
    final CatalogHttpException error = assertThrows(
        CatalogHttpException.class, () -> catalog.movie("0"));

    assertEquals(404, error.status());
    assertEquals("The resource you requested could not be found.",
        error.remoteMessage().orElseThrow());
  }

  @Test
  void whenVerifyingCredentials_givenStoreSetting_shouldUseIt() {
    final LibraryStore settings = createMock(LibraryStore.class);
    expect(settings.setting(TmdbCatalog.API_KEY_SETTING))
        .andReturn(Optional.of(" stored-key ")).times(2);
    replay(settings);
    server.serve("/movie/603", "{\"id\": 603}");
    final TmdbCatalog fromStore = catalog(TmdbConfig.builder()
        .baseUrl(server.baseUrl()).build(), settings);

    fromStore.verifyCredentials();
    fromStore.movie("603");

    assertEquals("stored-key", server.requests().get(0).params()
        .get("api_key"));
    verify(settings);
  }

  @Test
  void whenVerifyingCredentials_givenNoKeyAnywhere_shouldFail() {
    store.putSetting(TmdbCatalog.API_KEY_SETTING, "  ");
    final TmdbCatalog keyless = catalog(TmdbConfig.builder()
        .baseUrl(server.baseUrl()).build(), store);

    final MissingCredentialsException error = assertThrows(
        MissingCredentialsException.class, keyless::verifyCredentials);

    assertEquals("TMDB API key not configured", error.getMessage());
    assertThrows(MissingCredentialsException.class, () -> keyless.movie("1"));
    assertTrue(server.requests().isEmpty());
  }

  @Test
  void whenBuildingImageUrl_shouldJoinSizeAndPath() {
    final TmdbCatalog defaults = new TmdbCatalog(TmdbConfig.defaults(),
        store, new NoopCompletistMetrics());

    assertEquals("https://image.tmdb.org/t/p/w500/matrix.jpg",
        defaults.imageUrl("/matrix.jpg", ImageSize.W500));
    assertEquals("https://image.tmdb.org/t/p/original/b.jpg",
        defaults.imageUrl("/b.jpg", ImageSize.ORIGINAL));
    assertNull(defaults.imageUrl(null, ImageSize.W300));
  }

  private static TmdbCatalog catalog(final TmdbConfig config,
      final LibraryStore settings) {
    return new TmdbCatalog(config, settings, new CatalogHttpClient(
        TmdbCatalog.httpConfig(config), RateLimiters.video(),
        Clock.systemUTC(), new NoopCompletistMetrics()));
  }

  /** Reads a JSON fixture from the test classpath. */
  private static String fixture(final String name) {
    try (InputStream in = TmdbCatalogTest.class.getResourceAsStream(
        "/fixtures/" + name)) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
