package org.waabox.completist.analysis;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.completist.catalog.CatalogRelease;
import org.waabox.completist.catalog.CatalogTrack;
import org.waabox.completist.catalog.CoverArt;
import org.waabox.completist.catalog.MusicCatalog;
import org.waabox.completist.catalog.ReleaseGroup;
import org.waabox.completist.http.CatalogException;
import org.waabox.completist.model.AlbumCompleteness;
import org.waabox.completist.model.MissingTrack;
import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.MusicTrack;
import org.waabox.completist.model.Scope;
import org.waabox.completist.model.SourceType;
import org.waabox.completist.store.InMemoryLibraryStore;

/**
 * Tests for {@link AlbumTrackAnalyzer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class AlbumTrackAnalyzerTest {

  private static final Clock CLOCK = Clock.fixed(
      Instant.parse("2026-06-01T12:00:00Z"), ZoneOffset.UTC);

  private MusicCatalog catalog;

  private InMemoryLibraryStore store;

  private AlbumTrackAnalyzer analyzer;

  @BeforeEach
  void setUp() {
    catalog = createMock(MusicCatalog.class);
    store = new InMemoryLibraryStore();
    analyzer = new AlbumTrackAnalyzer(catalog, store, CLOCK);
  }

  @Test
  void whenAnalyzing_givenMissingTracks_shouldListThem() {
    // Arrange
    final MusicAlbum album = album("rg-1", "thumb.jpg");
    expect(catalog.tracklist("rg-1")).andReturn(Optional.of(release(
        new CatalogTrack("r1", "Intro", 1, 1, 60000L),
        new CatalogTrack("r2", "Don't Look Back", 2, 1, 200000L),
        new CatalogTrack("r3", "Outro", 3, 1, null))));
    replay(catalog);

    // Act
    final AlbumCompleteness result = analyzer.analyze(new AlbumUnit(album,
        List.of(track("t1", "intro"), track("t2", "Dont Look Back!")),
        Scope.all())).orElseThrow();

    // Assert
    assertEquals(3, result.totalTracks());
    assertEquals(2, result.ownedTracks());
    assertEquals(67, result.completenessPercentage());
    assertEquals(List.of(new MissingTrack("r3", "Outro", 3, 1, null)),
        result.missingTracks());
    assertEquals("rg-1", result.releaseGroupId());
    assertEquals("rel-1", result.releaseId());
    assertEquals("al-1", result.albumId());
    verify(catalog);
  }

  @Test
  void whenAnalyzing_givenNoTracklist_shouldNotProduceRecord() {
    expect(catalog.tracklist("rg-1")).andReturn(Optional.empty());
    replay(catalog);

    assertTrue(analyzer.analyze(new AlbumUnit(album("rg-1", "thumb.jpg"),
        List.of(), Scope.all())).isEmpty());
  }

  @Test
  void whenAnalyzing_givenUnknownAlbum_shouldNotProduceRecord() {
    expect(catalog.searchReleaseGroup("The Band", "Debut"))
        .andReturn(Optional.empty());
    replay(catalog);

    assertTrue(analyzer.analyze(new AlbumUnit(
        new MusicAlbum("al-1", "src", SourceType.PLEX, null, "ar-1",
            "The Band", "Debut (Deluxe Edition)", null, null, null,
            "thumb.jpg", null),
        List.of(), Scope.all())).isEmpty());
    verify(catalog);
  }

  @Test
  void whenAnalyzing_givenAlbumWithoutId_shouldSearchAndCacheIt() {
    final MusicAlbum album = new MusicAlbum("al-1", "src", SourceType.PLEX,
        null, "ar-1", "The Band", "Debut (2001)", 2001, null, null,
        "thumb.jpg", null);
    store.putAlbum(album);
    expect(catalog.searchReleaseGroup("The Band", "Debut")).andReturn(
        Optional.of(new ReleaseGroup("rg-9", "Debut", "Album", List.of(),
            2001)));
    expect(catalog.tracklist("rg-9")).andReturn(Optional.of(release(
        new CatalogTrack("r1", "Only", 1, 1, null))));
    replay(catalog);

    final AlbumCompleteness result = analyzer.analyze(new AlbumUnit(album,
        List.of(track("t1", "Only")), Scope.all())).orElseThrow();

    assertEquals(100, result.completenessPercentage());
    assertEquals("rg-9", store.album("al-1").orElseThrow().catalogId());
    verify(catalog);
  }

  @Test
  void whenAnalyzing_givenAlbumWithoutArtwork_shouldFetchCoverArt() {
    final MusicAlbum album = album("rg-1", null);
    store.putAlbum(album);
    expect(catalog.coverArt("rg-1")).andReturn(Optional.of(
        new CoverArt("front-500.jpg", "front-1200.jpg")));
    expect(catalog.tracklist("rg-1")).andReturn(Optional.of(release(
        new CatalogTrack("r1", "Only", 1, 1, null))));
    replay(catalog);

    analyzer.analyze(new AlbumUnit(album, List.of(), Scope.all()));

    final MusicAlbum updated = store.album("al-1").orElseThrow();
    assertEquals("front-500.jpg", updated.thumbUrl());
    assertEquals("front-1200.jpg", updated.artworkUrl());
    verify(catalog);
  }

  @Test
  void whenAnalyzing_givenCoverArtFailure_shouldStillAnalyze() {
    final MusicAlbum album = album("rg-1", null);
    expect(catalog.coverArt("rg-1"))
        .andThrow(new CatalogException("unreachable"));
    expect(catalog.tracklist("rg-1")).andReturn(Optional.of(release(
        new CatalogTrack("r1", "Only", 1, 1, null))));
    replay(catalog);

    final AlbumCompleteness result = analyzer.analyze(new AlbumUnit(album,
        List.of(), Scope.all())).orElseThrow();

    assertEquals(0, result.completenessPercentage());
  }

  private static MusicAlbum album(final String catalogId,
      final String thumbUrl) {
    return new MusicAlbum("al-1", "src", SourceType.PLEX, null, "ar-1",
        "The Band", "Debut", 2001, catalogId, null, thumbUrl, null);
  }

  private static MusicTrack track(final String id, final String title) {
    return new MusicTrack(id, "al-1", title, null, null);
  }

  private static CatalogRelease release(final CatalogTrack... tracks) {
    return new CatalogRelease("rg-1", "rel-1", "Debut", List.of(tracks));
  }
}
