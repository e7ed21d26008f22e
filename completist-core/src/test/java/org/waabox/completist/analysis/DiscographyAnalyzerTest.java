package org.waabox.completist.analysis;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.completist.catalog.CatalogArtist;
import org.waabox.completist.catalog.Discography;
import org.waabox.completist.catalog.MusicCatalog;
import org.waabox.completist.catalog.ReleaseGroup;
import org.waabox.completist.http.CatalogException;
import org.waabox.completist.model.ArtistCompleteness;
import org.waabox.completist.model.MissingRelease;
import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.MusicArtist;
import org.waabox.completist.model.ReleaseType;
import org.waabox.completist.model.Scope;
import org.waabox.completist.model.SourceType;
import org.waabox.completist.store.InMemoryLibraryStore;

/**
 * Tests for {@link DiscographyAnalyzer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DiscographyAnalyzerTest {

  private static final Clock CLOCK = Clock.fixed(
      Instant.parse("2026-06-01T12:00:00Z"), ZoneOffset.UTC);

  private static final CatalogArtist ARTIST = new CatalogArtist("mb-1",
      "The Band", "GB", "Group", "1990-03-01", null);

  private MusicCatalog catalog;

  private InMemoryLibraryStore store;

  private DiscographyAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    catalog = createMock(MusicCatalog.class);
    store = new InMemoryLibraryStore();
    analyzer = new DiscographyAnalyzer(catalog, store, CLOCK);
  }

  @Test
  void whenAnalyzing_givenAlbumsAndSingles_shouldWeighThem() {
    // Arrange
    expect(catalog.discography("mb-1")).andReturn(new Discography(ARTIST,
        List.of(
            group("a1", "First Album", "Album", 2001),
            group("a2", "Second Album", "Album", 2003),
            group("a3", "Third Album", "Album", 2005),
            group("s1", "Hit Single", "Single", 2001),
            group("s2", "Other Single", "Single", 2003))));
    replay(catalog);
    final ArtistUnit unit = unit(artist("mb-1"), false,
        album("x1", "First Album (Remastered)", null),
        album("x2", "whatever", "a3"),
        album("x3", "Hit Single", null));

    // Act
    final ArtistCompleteness result = analyzer.analyze(unit).orElseThrow();

    // Assert
    assertEquals(64, result.completenessPercentage());
    assertEquals(3, result.totalAlbums());
    assertEquals(2, result.ownedAlbums());
    assertEquals(0, result.totalEps());
    assertEquals(2, result.totalSingles());
    assertEquals(1, result.ownedSingles());
    assertEquals(List.of(new MissingRelease("a2", "Second Album", 2003,
        ReleaseType.ALBUM)), result.missingAlbums());
    assertEquals(List.of(new MissingRelease("s2", "Other Single", 2003,
        ReleaseType.SINGLE)), result.missingSingles());
    assertEquals("GB", result.country());
    assertEquals("Group", result.artistType());
    assertEquals(3, result.ownedItemCount());
    verify(catalog);
  }

  @Test
  void whenAnalyzingTwice_givenUnchangedInputs_shouldProduceTheSameRecord() {
    expect(catalog.discography("mb-1")).andReturn(new Discography(ARTIST,
        List.of(
            group("a1", "First Album", "Album", 2001),
            group("a2", "Second Album", "Album", 2003),
            group("e1", "Small Record", "EP", 2004),
            group("s1", "Hit Single", "Single", 2001)))).times(2);
    replay(catalog);
    final ArtistUnit unit = unit(artist("mb-1"), false,
        album("x1", "First Album", null), album("x2", "Other", "e1"));

    final ArtistCompleteness first = analyzer.analyze(unit).orElseThrow();
    final ArtistCompleteness second = analyzer.analyze(unit).orElseThrow();

    assertEquals(first, second);
    final List<MissingRelease> missing = new ArrayList<>();
    missing.addAll(first.missingAlbums());
    missing.addAll(first.missingEps());
    missing.addAll(first.missingSingles());
    for (final MissingRelease release : missing) {
      for (final MusicAlbum album : unit.albums()) {
        assertNotEquals(album.catalogId(), release.catalogId());
        assertNotEquals(TitleNormalizer.release(album.title()),
            TitleNormalizer.release(release.title()));
      }
    }
    assertEquals(List.of("a2", "s1"), missing.stream()
        .map(MissingRelease::catalogId).toList());
    verify(catalog);
  }

  @Test
  void whenAnalyzing_givenNonStudioAndFutureReleases_shouldLeaveThemOut() {
    final ReleaseGroup live = new ReleaseGroup("l1", "Live at Home",
        "Album", List.of("Live"), 2010);
    final ReleaseGroup compilation = new ReleaseGroup("c1", "Best Of",
        "Album", List.of("Compilation"), 2012);
    expect(catalog.discography("mb-1")).andReturn(new Discography(ARTIST,
        List.of(
            group("a1", "First Album", "Album", 2001),
            group("a9", "Next Album", "Album", 2027),
            group("b1", "Radio Session", "Broadcast", 2002),
            group("e1", "Small Record", "EP", null),
            live, compilation)));
    replay(catalog);

    final ArtistCompleteness result = analyzer.analyze(unit(artist("mb-1"),
        false, album("x1", "First Album", null))).orElseThrow();

    assertEquals(1, result.totalAlbums());
    assertEquals(1, result.totalEps());
    assertEquals(1, result.missingEps().size());
    // Owned 3 of 5 weighted points.
    assertEquals(60, result.completenessPercentage());
  }

  @Test
  void whenAnalyzing_givenVinylFilter_shouldDropVinylOnlyReleases() {
    expect(catalog.discography("mb-1")).andReturn(new Discography(ARTIST,
        List.of(
            group("a1", "First Album", "Album", 2001),
            group("a2", "Vinyl Album", "Album", 2003),
            group("a3", "Unknown Format", "Album", 2004))));
    expect(catalog.hasDigitalRelease("a1")).andReturn(true);
    expect(catalog.hasDigitalRelease("a2")).andReturn(false);
    expect(catalog.hasDigitalRelease("a3"))
        .andThrow(new CatalogException("timeout"));
    replay(catalog);

    final ArtistCompleteness result = analyzer.analyze(unit(artist("mb-1"),
        true, album("x1", "First Album", null))).orElseThrow();

    assertEquals(2, result.totalAlbums());
    assertEquals(1, result.ownedAlbums());
    assertEquals("a3", result.missingAlbums().get(0).catalogId());
    verify(catalog);
  }

  @Test
  void whenAnalyzing_givenUnknownArtist_shouldTreatAsComplete() {
    expect(catalog.searchArtist("Nobody")).andReturn(Optional.empty());
    replay(catalog);
    final MusicArtist artist = new MusicArtist("ar-1", "src", null,
        "Nobody", null, "thumb.jpg");

    final ArtistCompleteness result = analyzer.analyze(unit(artist, false,
        album("x1", "Demo", null), album("x2", "Demo 2", null)))
        .orElseThrow();

    assertEquals(100, result.completenessPercentage());
    assertNull(result.catalogId());
    assertEquals(2, result.ownedAlbums());
    assertTrue(result.missingAlbums().isEmpty());
    assertEquals("thumb.jpg", result.thumbUrl());
    verify(catalog);
  }

  @Test
  void whenAnalyzing_givenArtistWithoutCatalogId_shouldSearchAndCacheIt() {
    final MusicArtist artist = new MusicArtist("ar-1", "src", null,
        "The Band", null, null);
    store.putArtist(artist);
    expect(catalog.searchArtist("The Band")).andReturn(Optional.of(ARTIST));
    expect(catalog.discography("mb-1")).andReturn(new Discography(ARTIST,
        List.of()));
    replay(catalog);

    final ArtistCompleteness result = analyzer.analyze(unit(artist, false))
        .orElseThrow();

    assertEquals("mb-1", result.catalogId());
    assertEquals(100, result.completenessPercentage());
    assertEquals("mb-1", store.artist("ar-1").orElseThrow().catalogId());
    verify(catalog);
  }

  @Test
  void whenAnalyzing_givenReleaseLaterThisYear_shouldLeaveItOut() {
    expect(catalog.discography("mb-1")).andReturn(new Discography(ARTIST,
        List.of(
            group("a1", "First Album", "Album", 2001),
            new ReleaseGroup("a2", "Upcoming", "Album", List.of(), null,
                LocalDate.of(2026, 12, 4)),
            new ReleaseGroup("a3", "Spring Album", "Album", List.of(), null,
                LocalDate.of(2026, 3, 20)),
            new ReleaseGroup("s1", "Today Single", "Single", List.of(), null,
                LocalDate.of(2026, 6, 1)))));
    replay(catalog);

    final ArtistCompleteness result = analyzer.analyze(unit(artist("mb-1"),
        false, album("x1", "First Album", null))).orElseThrow();

    assertEquals(2, result.totalAlbums());
    assertEquals(List.of(new MissingRelease("a3", "Spring Album", 2026,
        ReleaseType.ALBUM)), result.missingAlbums());
    assertEquals(1, result.totalSingles());
    verify(catalog);
  }

  @Test
  void whenClassifying_givenReleaseTypes_shouldMapThem() {
    assertEquals(Optional.of(ReleaseType.ALBUM), DiscographyAnalyzer.classify(
        group("1", "x", "Album", 2000)));
    assertEquals(Optional.of(ReleaseType.EP), DiscographyAnalyzer.classify(
        group("1", "x", "EP", 2000)));
    assertEquals(Optional.of(ReleaseType.SINGLE),
        DiscographyAnalyzer.classify(group("1", "x", "Single", 2000)));
    assertTrue(DiscographyAnalyzer.classify(new ReleaseGroup("1", "x",
        "Album", List.of("Soundtrack"), 2000)).isEmpty());
    assertTrue(DiscographyAnalyzer.classify(group("1", "x", "Other", 2000))
        .isEmpty());
  }

  private static MusicArtist artist(final String catalogId) {
    return new MusicArtist("ar-1", "src", null, "The Band", catalogId, null);
  }

  private static ArtistUnit unit(final MusicArtist artist,
      final boolean filterVinylOnly, final MusicAlbum... albums) {
    return new ArtistUnit(artist, new ArrayList<>(List.of(albums)),
        Scope.all(), filterVinylOnly);
  }

  private static MusicAlbum album(final String id, final String title,
      final String catalogId) {
    return new MusicAlbum(id, "src", SourceType.PLEX, null, "ar-1",
        "The Band", title, null, catalogId, null, null, null);
  }

  private static ReleaseGroup group(final String id, final String title,
      final String primaryType, final Integer year) {
    return new ReleaseGroup(id, title, primaryType, List.of(), year);
  }
}
