package org.waabox.completist.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.completist.model.CollectionCompleteness;
import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.Scope;
import org.waabox.completist.model.SourceType;

/**
 * Tests for {@link InMemoryLibraryStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class InMemoryLibraryStoreTest {

  @Test
  void whenWriting_givenNoBatch_shouldPersistEveryChange() {
    // Arrange
    final RecordingStore store = new RecordingStore();

    // Act
    store.putOwnedItem(movie("m1", "plex"));
    store.putSetting("tmdb_api_key", "secret");

    // Assert
    assertEquals(2, store.persisted.size());
    assertEquals(2, store.checkpoints());
    assertEquals("secret", store.persisted.get(1).settings()
        .get("tmdb_api_key"));
  }

  @Test
  void whenWriting_insideBatch_shouldPersistOnlyOnCheckpointsAndClose() {
    final RecordingStore store = new RecordingStore();

    store.beginWriteBatch();
    store.putOwnedItem(movie("m1", "plex"));
    store.putOwnedItem(movie("m2", "plex"));
    assertTrue(store.persisted.isEmpty());

    store.forceCheckpoint();
    assertEquals(1, store.persisted.size());
    assertEquals(2, store.persisted.get(0).ownedItems().size());

    store.forceCheckpoint();
    assertEquals(1, store.persisted.size());

    store.putOwnedItem(movie("m3", "plex"));
    store.endWriteBatch();

    assertEquals(2, store.persisted.size());
    assertFalse(store.inWriteBatch());
  }

  @Test
  void whenOpeningBatch_givenOneAlreadyOpen_shouldThrow() {
    final InMemoryLibraryStore store = new InMemoryLibraryStore();
    store.beginWriteBatch();

    assertThrows(IllegalStateException.class, store::beginWriteBatch);
  }

  @Test
  void whenQueryingRecords_givenScopes_shouldFilterByScope() {
    final InMemoryLibraryStore store = new InMemoryLibraryStore();
    store.upsert(collection("10", Scope.of("plex")));
    store.upsert(collection("10", Scope.of("jellyfin")));
    store.upsert(collection("11", Scope.all()));

    assertEquals(3, store.records(CollectionCompleteness.class,
        Scope.all()).size());
    assertEquals(1, store.records(CollectionCompleteness.class,
        Scope.of("plex")).size());
    assertTrue(store.record(CollectionCompleteness.class, "10",
        Scope.of("jellyfin")).isPresent());
    assertTrue(store.record(CollectionCompleteness.class, "11",
        Scope.of("plex")).isEmpty());
  }

  @Test
  void whenUpserting_givenSameUnitAndScope_shouldReplaceRecord() {
    final InMemoryLibraryStore store = new InMemoryLibraryStore();
    store.upsert(collection("10", Scope.of("plex")));
    store.upsert(new CollectionCompleteness("10", "Renamed",
        Scope.of("plex"), 2, 2, List.of(), List.of(), 100, 2, null, null,
        Instant.EPOCH));

    final List<CollectionCompleteness> records = store.records(
        CollectionCompleteness.class, Scope.of("plex"));
    assertEquals(1, records.size());
    assertEquals("Renamed", records.get(0).name());
  }

  @Test
  void whenDeletingRecords_shouldOnlyRemoveCoveredOnes() {
    final InMemoryLibraryStore store = new InMemoryLibraryStore();
    store.upsert(collection("10", Scope.of("plex")));
    store.upsert(collection("10", Scope.of("jellyfin")));

    store.deleteRecords(CollectionCompleteness.class, Scope.of("plex"));

    assertEquals(1, store.records(CollectionCompleteness.class,
        Scope.all()).size());
  }

  @Test
  void whenUpdatingArtwork_givenPartialUpdates_shouldMergeThem() {
    final InMemoryLibraryStore store = new InMemoryLibraryStore();
    store.putOwnedItem(movie("m1", "local"));

    store.updateArtwork("m1", new ArtworkUpdate(null, "thumb", "season"));
    store.updateArtwork("m1", ArtworkUpdate.poster("poster"));

    final ArtworkUpdate artwork = store.artwork("m1").orElseThrow();
    assertEquals("poster", artwork.posterUrl());
    assertEquals("thumb", artwork.thumbUrl());
    assertEquals("season", artwork.seasonPosterUrl());
    assertEquals("poster", store.ownedItem("m1").orElseThrow().posterUrl());
  }

  @Test
  void whenCachingCatalogIds_shouldUpdateItemsAndIgnoreUnknownOnes() {
    final InMemoryLibraryStore store = new InMemoryLibraryStore();
    store.putOwnedItem(movie("m1", "plex"));
    store.putAlbum(new MusicAlbum("al-1", "plex", SourceType.PLEX, null,
        "ar-1", "Band", "Album", null, null, null, null, null));

    store.updateCatalogId("m1", "348");
    store.updateCatalogId("unknown", "1");
    store.updateAlbumCatalogId("al-1", "rg-1");
    store.updateAlbumArtwork("al-1", "thumb", "full");

    assertEquals("348", store.ownedItem("m1").orElseThrow().catalogId());
    assertTrue(store.ownedItem("unknown").isEmpty());
    final MusicAlbum album = store.album("al-1").orElseThrow();
    assertEquals("rg-1", album.catalogId());
    assertEquals("thumb", album.thumbUrl());
    assertEquals("full", album.artworkUrl());
  }

  @Test
  void whenRestoring_shouldReplaceContentsWithoutPersisting() {
    final RecordingStore source = new RecordingStore();
    source.putOwnedItem(movie("m1", "plex"));
    source.upsert(collection("10", Scope.of("plex")));
    final RecordingStore target = new RecordingStore();
    target.putOwnedItem(movie("old", "plex"));
    target.persisted.clear();

    target.restore(source.contents());

    assertTrue(target.persisted.isEmpty());
    assertTrue(target.ownedItem("old").isEmpty());
    assertTrue(target.ownedItem("m1").isPresent());
    assertEquals(1, target.records(CollectionCompleteness.class,
        Scope.all()).size());
  }

  @Test
  void whenPuttingSetting_givenNull_shouldRemoveIt() {
    final InMemoryLibraryStore store = new InMemoryLibraryStore();
    store.putSetting("key", "value");

    store.putSetting("key", null);

    assertTrue(store.setting("key").isEmpty());
  }

  @Test
  void whenListingOwnedItems_shouldFilterByKindAndScope() {
    final InMemoryLibraryStore store = new InMemoryLibraryStore();
    store.putOwnedItem(movie("m1", "plex"));
    store.putOwnedItem(movie("m2", "jellyfin"));
    store.putOwnedItem(OwnedItem.episode("e1", "plex", SourceType.PLEX,
        "Show", 1, 1, 0));

    assertEquals(1, store.ownedItems(OwnedItemFilter.movies(
        Scope.of("plex"))).size());
    assertEquals(2, store.ownedItems(OwnedItemFilter.movies(
        Scope.all())).size());
    assertEquals(1, store.ownedItems(OwnedItemFilter.episodesOf("Show",
        Scope.all())).size());
    assertNull(store.ownedItems(OwnedItemFilter.episodes(Scope.all()))
        .get(0).catalogId());
  }

  private static OwnedItem movie(final String id, final String sourceId) {
    return OwnedItem.movie(id, sourceId, SourceType.PLEX, "Movie " + id,
        2000, null, 0);
  }

  private static CollectionCompleteness collection(final String id,
      final Scope scope) {
    return new CollectionCompleteness(id, "Saga " + id, scope, 2, 1,
        List.of(), List.of(), 50, 1, null, null, Instant.EPOCH);
  }

  /** A store remembering every snapshot it was asked to persist. */
  private static final class RecordingStore extends InMemoryLibraryStore {

    private final List<LibraryContents> persisted = new ArrayList<>();

    @Override
    protected void persist(final LibraryContents contents) {
      persisted.add(contents);
    }
  }
}
