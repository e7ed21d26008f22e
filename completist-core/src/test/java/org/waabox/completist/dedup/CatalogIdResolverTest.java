package org.waabox.completist.dedup;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.completist.catalog.CatalogSearchResult;
import org.waabox.completist.catalog.ExternalIdMatches;
import org.waabox.completist.catalog.VideoCatalog;
import org.waabox.completist.http.CatalogException;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.SourceType;

/**
 * Tests for {@link CatalogIdResolver}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CatalogIdResolverTest {

  private VideoCatalog catalog;

  private CatalogIdResolver resolver;

  @BeforeEach
  void setUp() {
    catalog = createMock(VideoCatalog.class);
    resolver = new CatalogIdResolver(catalog);
  }

  @Test
  void whenResolvingMovie_givenKnownId_shouldNotCallCatalog() {
    // Arrange
    replay(catalog);
    final OwnedItem movie = OwnedItem.movie("m1", "src", SourceType.PLEX,
        "Alien", 1979, "348", 0);

    // Act
    final Optional<String> id = resolver.resolveMovie(movie);

    // Assert
    assertEquals(Optional.of("348"), id);
    verify(catalog);
  }

  @Test
  void whenResolvingMovie_givenImdbId_shouldUseCrossReference() {
    expect(catalog.findByImdbId("tt0078748")).andReturn(
        new ExternalIdMatches(List.of("348"), List.of()));
    replay(catalog);
    final OwnedItem movie = OwnedItem.movie("m1", "src", SourceType.PLEX,
        "Alien", 1979, null, 0).withCrossReferenceId("tt0078748");

    assertEquals(Optional.of("348"), resolver.resolveMovie(movie));
    verify(catalog);
  }

  @Test
  void whenResolvingMovie_givenImdbLookupFails_shouldFallBackToSearch() {
    expect(catalog.findByImdbId("tt0078748"))
        .andThrow(new CatalogException("down"));
    expect(catalog.searchMovies("Alien", 1979)).andReturn(List.of(
        new CatalogSearchResult("1", "Alien", 2019),
        new CatalogSearchResult("348", "Alien", 1979)));
    replay(catalog);
    final OwnedItem movie = OwnedItem.movie("m1", "src", SourceType.PLEX,
        "Alien", 1979, null, 0).withCrossReferenceId("tt0078748");

    assertEquals(Optional.of("348"), resolver.resolveMovie(movie));
    verify(catalog);
  }

  @Test
  void whenResolvingMovie_givenNoYearMatch_shouldTakeTopResult() {
    expect(catalog.searchMovies("Alien", 1980)).andReturn(List.of(
        new CatalogSearchResult("1", "Alien", 2019),
        new CatalogSearchResult("348", "Alien", 1979)));
    replay(catalog);
    final OwnedItem movie = OwnedItem.movie("m1", "src", SourceType.PLEX,
        "Alien", 1980, null, 0);

    assertEquals(Optional.of("1"), resolver.resolveMovie(movie));
  }

  @Test
  void whenResolvingMovie_givenSearchFailure_shouldReturnEmpty() {
    expect(catalog.searchMovies("Alien", null))
        .andThrow(new CatalogException("down"));
    replay(catalog);
    final OwnedItem movie = OwnedItem.movie("m1", "src", SourceType.PLEX,
        "Alien", null, null, 0);

    assertTrue(resolver.resolveMovie(movie).isEmpty());
  }

  @Test
  void whenResolvingShow_givenEpisodeWithSeriesId_shouldUseIt() {
    replay(catalog);
    final List<OwnedItem> episodes = List.of(
        episode("e1").withSeriesCatalogId("1399"));

    assertEquals(Optional.of("1399"),
        resolver.resolveShow("Thrones", episodes));
    verify(catalog);
  }

  @Test
  void whenResolvingShow_givenImdbCrossReference_shouldUseShowIds() {
    expect(catalog.findByImdbId("tt0944947")).andReturn(
        new ExternalIdMatches(List.of(), List.of("1399")));
    replay(catalog);
    final List<OwnedItem> episodes = List.of(episode("e1"),
        episode("e2").withCrossReferenceId("tt0944947"));

    assertEquals(Optional.of("1399"),
        resolver.resolveShow("Thrones", episodes));
    verify(catalog);
  }

  @Test
  void whenResolvingShow_givenOnlyTitle_shouldTakeTopSearchResult() {
    expect(catalog.searchShows("Thrones")).andReturn(List.of(
        new CatalogSearchResult("1399", "Game of Thrones", 2011),
        new CatalogSearchResult("2", "Thrones", 2020)));
    replay(catalog);

    assertEquals(Optional.of("1399"),
        resolver.resolveShow("Thrones", List.of(episode("e1"))));
  }

  private static OwnedItem episode(final String id) {
    return OwnedItem.episode(id, "src", SourceType.PLEX, "Thrones", 1, 1, 0);
  }
}
