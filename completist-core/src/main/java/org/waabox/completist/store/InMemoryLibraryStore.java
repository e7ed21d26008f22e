package org.waabox.completist.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.model.AlbumCompleteness;
import org.waabox.completist.model.ArtistCompleteness;
import org.waabox.completist.model.CollectionCompleteness;
import org.waabox.completist.model.CompletenessRecord;
import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.MusicArtist;
import org.waabox.completist.model.MusicTrack;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.Scope;
import org.waabox.completist.model.SeriesCompleteness;

/**
 * A {@link LibraryStore} that keeps everything in memory.
 *
 * <p>Every mutation marks the store dirty. Outside a write batch the store
 * is flushed through {@link #persist(LibraryContents)} right away; inside a
 * batch flushing waits for {@link #forceCheckpoint()} or
 * {@link #endWriteBatch()}. This class does not persist anything itself:
 * subclasses override {@link #persist(LibraryContents)}.
 *
 * <p>All methods are synchronized on the store.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class InMemoryLibraryStore implements LibraryStore {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      InMemoryLibraryStore.class);

  /** The owned movies and episodes, keyed by id. */
  private final Map<String, OwnedItem> ownedItems = new LinkedHashMap<>();

  /** The owned artists, keyed by id. */
  private final Map<String, MusicArtist> artists = new LinkedHashMap<>();

  /** The owned albums, keyed by id. */
  private final Map<String, MusicAlbum> albums = new LinkedHashMap<>();

  /** The owned tracks, keyed by id. */
  private final Map<String, MusicTrack> tracks = new LinkedHashMap<>();

  /** The settings. */
  private final Map<String, String> settings = new HashMap<>();

  /** The artwork pushed back, keyed by item id. */
  private final Map<String, ArtworkUpdate> artwork = new HashMap<>();

  /** The completeness records, per type, keyed by unit and scope. */
  private final Map<Class<?>, Map<String, CompletenessRecord>> records =
      new HashMap<>();

  /** Whether a write batch is open. */
  private boolean batchOpen;

  /** Whether there are writes not flushed yet. */
  private boolean dirty;

  /** The number of flushes performed. */
  private int checkpoints;

  /** Creates an empty store. */
  public InMemoryLibraryStore() {
  }

  /**
   * Adds or replaces an owned movie or episode.
   *
   * @param item the item, never null
   */
  public synchronized void putOwnedItem(final OwnedItem item) {
    Objects.requireNonNull(item, "item must not be null");
    ownedItems.put(item.id(), item);
    changed();
  }

  /**
   * Adds or replaces an owned artist.
   *
   * @param artist the artist, never null
   */
  public synchronized void putArtist(final MusicArtist artist) {
    Objects.requireNonNull(artist, "artist must not be null");
    artists.put(artist.id(), artist);
    changed();
  }

  /**
   * Adds or replaces an owned album.
   *
   * @param album the album, never null
   */
  public synchronized void putAlbum(final MusicAlbum album) {
    Objects.requireNonNull(album, "album must not be null");
    albums.put(album.id(), album);
    changed();
  }

  /**
   * Adds or replaces an owned track.
   *
   * @param track the track, never null
   */
  public synchronized void putTrack(final MusicTrack track) {
    Objects.requireNonNull(track, "track must not be null");
    tracks.put(track.id(), track);
    changed();
  }

  /**
   * Returns an owned item by id.
   *
   * @param itemId the item id, never null
   * @return the item, or empty if unknown
   */
  public synchronized Optional<OwnedItem> ownedItem(final String itemId) {
    return Optional.ofNullable(ownedItems.get(itemId));
  }

  /**
   * Returns an owned artist by id.
   *
   * @param artistId the artist id, never null
   * @return the artist, or empty if unknown
   */
  public synchronized Optional<MusicArtist> artist(final String artistId) {
    return Optional.ofNullable(artists.get(artistId));
  }

  /**
   * Returns an owned album by id.
   *
   * @param albumId the album id, never null
   * @return the album, or empty if unknown
   */
  public synchronized Optional<MusicAlbum> album(final String albumId) {
    return Optional.ofNullable(albums.get(albumId));
  }

  /**
   * Returns the artwork pushed back for an item.
   *
   * @param itemId the item id, never null
   * @return the artwork, or empty if none was pushed
   */
  public synchronized Optional<ArtworkUpdate> artwork(final String itemId) {
    return Optional.ofNullable(artwork.get(itemId));
  }

  /**
   * Returns how many times the store was flushed.
   *
   * @return the number of flushes
   */
  public synchronized int checkpoints() {
    return checkpoints;
  }

  /**
   * Tells whether a write batch is open.
   *
   * @return true while a batch is open
   */
  public synchronized boolean inWriteBatch() {
    return batchOpen;
  }

  /** {@inheritDoc} */
  @Override
  public synchronized List<OwnedItem> ownedItems(
      final OwnedItemFilter filter) {
    Objects.requireNonNull(filter, "filter must not be null");
    return ownedItems.values().stream().filter(filter::matches).toList();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized List<MusicArtist> artists(final Scope scope) {
    Objects.requireNonNull(scope, "scope must not be null");
    return artists.values().stream()
        .filter(a -> scope.covers(a.sourceId(), a.libraryId()))
        .toList();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized List<MusicAlbum> albums(final Scope scope) {
    Objects.requireNonNull(scope, "scope must not be null");
    return albums.values().stream()
        .filter(a -> scope.covers(a.sourceId(), a.libraryId()))
        .toList();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized List<MusicAlbum> albumsOfArtist(final String artistId) {
    Objects.requireNonNull(artistId, "artistId must not be null");
    return albums.values().stream()
        .filter(a -> artistId.equals(a.artistId()))
        .toList();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized List<MusicTrack> tracksOfAlbum(final String albumId) {
    Objects.requireNonNull(albumId, "albumId must not be null");
    return tracks.values().stream()
        .filter(t -> albumId.equals(t.albumId()))
        .toList();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void upsert(final CompletenessRecord record) {
    Objects.requireNonNull(record, "record must not be null");
    records.computeIfAbsent(record.getClass(), k -> new LinkedHashMap<>())
        .put(recordKey(record.unitKey(), record.scope()), record);
    changed();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized <R extends CompletenessRecord> Optional<R> record(
      final Class<R> type, final String unitKey, final Scope scope) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(unitKey, "unitKey must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    final Map<String, CompletenessRecord> byKey = records.get(type);
    if (byKey == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byKey.get(recordKey(unitKey, scope)))
        .map(type::cast);
  }

  /** {@inheritDoc} */
  @Override
  public synchronized <R extends CompletenessRecord> List<R> records(
      final Class<R> type, final Scope scope) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    final Map<String, CompletenessRecord> byKey = records.get(type);
    if (byKey == null) {
      return List.of();
    }
    return byKey.values().stream()
        .filter(r -> covers(scope, r.scope()))
        .map(type::cast)
        .toList();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void deleteRecords(
      final Class<? extends CompletenessRecord> type, final Scope scope) {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    final Map<String, CompletenessRecord> byKey = records.get(type);
    if (byKey != null
        && byKey.values().removeIf(r -> covers(scope, r.scope()))) {
      changed();
    }
  }

  /** {@inheritDoc} */
  @Override
  public synchronized Optional<String> setting(final String key) {
    Objects.requireNonNull(key, "key must not be null");
    return Optional.ofNullable(settings.get(key));
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void putSetting(final String key, final String value) {
    Objects.requireNonNull(key, "key must not be null");
    if (value == null) {
      settings.remove(key);
    } else {
      settings.put(key, value);
    }
    changed();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void updateCatalogId(final String itemId,
      final String catalogId) {
    Objects.requireNonNull(catalogId, "catalogId must not be null");
    final OwnedItem item = ownedItems.get(itemId);
    if (item == null) {
      log.debug("Ignoring catalog id for unknown item {}", itemId);
      return;
    }
    ownedItems.put(itemId, item.withCatalogId(catalogId));
    changed();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void updateArtistCatalogId(final String artistId,
      final String catalogId) {
    Objects.requireNonNull(catalogId, "catalogId must not be null");
    final MusicArtist artist = artists.get(artistId);
    if (artist == null) {
      log.debug("Ignoring catalog id for unknown artist {}", artistId);
      return;
    }
    artists.put(artistId, artist.withCatalogId(catalogId));
    changed();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void updateAlbumCatalogId(final String albumId,
      final String releaseGroupId) {
    Objects.requireNonNull(releaseGroupId, "releaseGroupId must not be null");
    final MusicAlbum album = albums.get(albumId);
    if (album == null) {
      log.debug("Ignoring catalog id for unknown album {}", albumId);
      return;
    }
    albums.put(albumId, album.withCatalogId(releaseGroupId));
    changed();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void updateArtwork(final String itemId,
      final ArtworkUpdate update) {
    Objects.requireNonNull(itemId, "itemId must not be null");
    Objects.requireNonNull(update, "update must not be null");
    final ArtworkUpdate previous = artwork.get(itemId);
    final ArtworkUpdate merged = previous == null ? update
        : new ArtworkUpdate(
            firstNonNull(update.posterUrl(), previous.posterUrl()),
            firstNonNull(update.thumbUrl(), previous.thumbUrl()),
            firstNonNull(update.seasonPosterUrl(),
                previous.seasonPosterUrl()));
    artwork.put(itemId, merged);

    final OwnedItem item = ownedItems.get(itemId);
    if (item != null && update.posterUrl() != null) {
      ownedItems.put(itemId, item.withPosterUrl(update.posterUrl()));
    }
    changed();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void updateAlbumArtwork(final String albumId,
      final String thumbUrl, final String artworkUrl) {
    final MusicAlbum album = albums.get(albumId);
    if (album == null) {
      log.debug("Ignoring artwork for unknown album {}", albumId);
      return;
    }
    albums.put(albumId, album.withArtwork(thumbUrl, artworkUrl));
    changed();
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void beginWriteBatch() {
    if (batchOpen) {
      throw new IllegalStateException("A write batch is already open");
    }
    batchOpen = true;
    log.debug("Write batch opened");
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void endWriteBatch() {
    if (!batchOpen) {
      return;
    }
    batchOpen = false;
    flush();
    log.debug("Write batch closed");
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void forceCheckpoint() {
    flush();
  }

  /**
   * Returns a copy of everything the store holds.
   *
   * @return the contents, never null
   */
  public synchronized LibraryContents contents() {
    return new LibraryContents(
        new ArrayList<>(ownedItems.values()),
        new ArrayList<>(artists.values()),
        new ArrayList<>(albums.values()),
        new ArrayList<>(tracks.values()),
        settings,
        artwork,
        records(SeriesCompleteness.class, Scope.all()),
        records(CollectionCompleteness.class, Scope.all()),
        records(ArtistCompleteness.class, Scope.all()),
        records(AlbumCompleteness.class, Scope.all()));
  }

  /**
   * Replaces everything the store holds, without flushing.
   *
   * @param contents the contents to load, never null
   */
  protected synchronized void restore(final LibraryContents contents) {
    Objects.requireNonNull(contents, "contents must not be null");
    ownedItems.clear();
    artists.clear();
    albums.clear();
    tracks.clear();
    settings.clear();
    artwork.clear();
    records.clear();
    contents.ownedItems().forEach(i -> ownedItems.put(i.id(), i));
    contents.artists().forEach(a -> artists.put(a.id(), a));
    contents.albums().forEach(a -> albums.put(a.id(), a));
    contents.tracks().forEach(t -> tracks.put(t.id(), t));
    settings.putAll(contents.settings());
    artwork.putAll(contents.artwork());
    contents.seriesCompleteness().forEach(this::restoreRecord);
    contents.collectionCompleteness().forEach(this::restoreRecord);
    contents.artistCompleteness().forEach(this::restoreRecord);
    contents.albumCompleteness().forEach(this::restoreRecord);
    dirty = false;
  }

  /**
   * Writes the contents to durable storage. Does nothing by default.
   *
   * @param contents the contents to persist, never null
   */
  protected void persist(final LibraryContents contents) {
  }

  /** Marks the store dirty and flushes it unless a batch is open. */
  private void changed() {
    dirty = true;
    if (!batchOpen) {
      flush();
    }
  }

  /** Persists pending writes, if any. */
  private void flush() {
    if (!dirty) {
      return;
    }
    persist(contents());
    dirty = false;
    checkpoints++;
  }

  /**
   * Indexes a record without marking the store dirty.
   *
   * @param record the record, never null
   */
  private void restoreRecord(final CompletenessRecord record) {
    records.computeIfAbsent(record.getClass(), k -> new LinkedHashMap<>())
        .put(recordKey(record.unitKey(), record.scope()), record);
  }

  /**
   * Tells whether a record scope falls within a query scope.
   *
   * @param query  the query scope, never null
   * @param stored the record scope, never null
   * @return true if the record is selected
   */
  private static boolean covers(final Scope query, final Scope stored) {
    if (query.crossProvider()) {
      return true;
    }
    return query.covers(stored.sourceId(), stored.libraryId());
  }

  /**
   * Builds the index key of a record.
   *
   * @param unitKey the unit key, never null
   * @param scope   the scope, never null
   * @return the key, never null
   */
  private static String recordKey(final String unitKey, final Scope scope) {
    return unitKey + "@" + scope.key();
  }

  /**
   * Returns the first argument unless it is null.
   *
   * @param first  the preferred value, may be null
   * @param second the fallback value, may be null
   * @return the first non null value, may be null
   */
  private static String firstNonNull(final String first,
      final String second) {
    return first != null ? first : second;
  }
}
