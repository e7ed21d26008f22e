package org.waabox.completist.analysis;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.anyString;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.getCurrentArgument;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.completist.catalog.CatalogCollection;
import org.waabox.completist.catalog.CatalogMovie;
import org.waabox.completist.catalog.ImageSize;
import org.waabox.completist.catalog.VideoCatalog;
import org.waabox.completist.model.CollectionCompleteness;
import org.waabox.completist.model.MissingMovie;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.Scope;
import org.waabox.completist.model.SourceType;
import org.waabox.completist.store.InMemoryLibraryStore;

/**
 * Tests for {@link CollectionCompletenessAnalyzer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CollectionCompletenessAnalyzerTest {

  private static final Clock CLOCK = Clock.fixed(
      Instant.parse("2026-06-01T12:00:00Z"), ZoneOffset.UTC);

  private VideoCatalog catalog;

  private InMemoryLibraryStore store;

  private CollectionCompletenessAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    catalog = createMock(VideoCatalog.class);
    store = new InMemoryLibraryStore();
    analyzer = new CollectionCompletenessAnalyzer(catalog, store, CLOCK);
    expect(catalog.imageUrl(anyString(), anyObject(ImageSize.class)))
        .andAnswer(() -> {
          final String path = getCurrentArgument(0);
          final ImageSize size = getCurrentArgument(1);
          return path == null ? null : size.code() + path;
        }).anyTimes();
  }

  @Test
  void whenAnalyzing_givenOneReleasedMember_shouldNotTrackCollection() {
    // Arrange
    expect(catalog.collection("10")).andReturn(collection(
        part("1", "First", LocalDate.of(2020, 5, 1)),
        part("2", "Sequel", LocalDate.of(2027, 5, 1)),
        part("3", "Untitled", null)));
    replay(catalog);

    // Act & Assert
    assertTrue(analyzer.analyze(unit(movie("m1", "1", SourceType.PLEX)))
        .isEmpty());
    verify(catalog);
  }

  @Test
  void whenAnalyzing_givenTwoOfThreeOwned_shouldListTheMissingOne() {
    expect(catalog.collection("10")).andReturn(collection(
        part("1", "First", LocalDate.of(2001, 5, 1)),
        part("2", "Second", LocalDate.of(2003, 5, 1)),
        part("3", "Third", LocalDate.of(2005, 5, 1)),
        part("4", "Fourth", LocalDate.of(2030, 5, 1))));
    replay(catalog);

    final CollectionCompleteness result = analyzer.analyze(unit(
        movie("m1", "1", SourceType.PLEX),
        movie("m3", "3", SourceType.PLEX))).orElseThrow();

    assertEquals(3, result.totalMovies());
    assertEquals(2, result.ownedMovies());
    assertEquals(67, result.completenessPercentage());
    assertEquals(List.of("1", "3"), result.ownedMovieIds());
    assertEquals(List.of(new MissingMovie("2", "Second", 2003,
        "w300/2.jpg")), result.missingMovies());
    assertEquals("w500/collection.jpg", result.posterUrl());
    assertEquals("original/collection-bg.jpg", result.backdropUrl());
    assertEquals("Saga", result.name());
    assertEquals(2, result.ownedItemCount());
  }

  @Test
  void whenAnalyzingTwice_givenUnchangedInputs_shouldProduceTheSameRecord() {
    expect(catalog.collection("10")).andReturn(collection(
        part("1", "First", LocalDate.of(2001, 5, 1)),
        part("2", "Second", LocalDate.of(2003, 5, 1)),
        part("3", "Third", LocalDate.of(2005, 5, 1)),
        part("4", "Fourth", LocalDate.of(2008, 5, 1)))).times(2);
    replay(catalog);
    final CollectionUnit unit = unit(movie("m2", "2", SourceType.PLEX),
        movie("m4", "4", SourceType.PLEX));

    final CollectionCompleteness first = analyzer.analyze(unit).orElseThrow();
    final CollectionCompleteness second = analyzer.analyze(unit)
        .orElseThrow();

    assertEquals(first, second);
    for (final MissingMovie missing : first.missingMovies()) {
      assertFalse(first.ownedMovieIds().contains(missing.catalogId()));
    }
    assertEquals(first.totalMovies(), first.ownedMovieIds().size()
        + first.missingMovies().size());
    verify(catalog);
  }

  @Test
  void whenAnalyzing_givenDuplicateCopies_shouldCountMovieOnce() {
    expect(catalog.collection("10")).andReturn(collection(
        part("1", "First", LocalDate.of(2001, 5, 1)),
        part("2", "Second", LocalDate.of(2003, 5, 1))));
    replay(catalog);

    final CollectionCompleteness result = analyzer.analyze(unit(
        movie("m1", "1", SourceType.PLEX),
        movie("m1-4k", "1", SourceType.JELLYFIN))).orElseThrow();

    assertEquals(1, result.ownedMovies());
    assertEquals(50, result.completenessPercentage());
    assertEquals(2, result.ownedItemCount());
  }

  @Test
  void whenAnalyzing_givenLocalMovie_shouldPushPoster() {
    final OwnedItem local = movie("m1", "1", SourceType.LOCAL);
    store.putOwnedItem(local);
    expect(catalog.collection("10")).andReturn(collection(
        part("1", "First", LocalDate.of(2001, 5, 1)),
        part("2", "Second", LocalDate.of(2003, 5, 1))));
    replay(catalog);

    analyzer.analyze(unit(local));

    assertEquals("w500/1.jpg", store.artwork("m1").orElseThrow().posterUrl());
    assertEquals("w500/1.jpg",
        store.ownedItem("m1").orElseThrow().posterUrl());
  }

  private static CollectionUnit unit(final OwnedItem... movies) {
    return new CollectionUnit("10", Scope.all(), List.of(movies));
  }

  private static OwnedItem movie(final String id, final String catalogId,
      final SourceType sourceType) {
    return OwnedItem.movie(id, "src", sourceType, "Movie " + catalogId,
        null, catalogId, 0);
  }

  private static CatalogMovie part(final String id, final String title,
      final LocalDate releaseDate) {
    return new CatalogMovie(id, title, releaseDate, "/" + id + ".jpg", "10",
        "Saga");
  }

  private static CatalogCollection collection(final CatalogMovie... parts) {
    return new CatalogCollection("10", "Saga", "/collection.jpg",
        "/collection-bg.jpg", List.of(parts));
  }
}
