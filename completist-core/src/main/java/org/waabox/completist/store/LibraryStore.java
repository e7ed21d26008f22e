package org.waabox.completist.store;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

import org.waabox.completist.model.CompletenessRecord;
import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.MusicArtist;
import org.waabox.completist.model.MusicTrack;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.Scope;

/**
 * The local data store, as consumed by the completeness engine.
 *
 * <p>The store owns the owned items, settings and completeness records.
 * The engine reads owned items, writes completeness records and caches
 * resolved catalog ids and artwork back.
 *
 * <p>While a write batch is open, writes may be kept in memory until
 * {@link #forceCheckpoint()} or {@link #endWriteBatch()} flushes them. Only
 * one batch can be open at a time.
 *
 * <p>Implementations must be thread-safe: units of a batch are analyzed
 * concurrently.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface LibraryStore {

  /**
   * Returns the owned movies or episodes selected by a filter.
   *
   * @param filter the filter, never null
   * @return the items, never null
   */
  List<OwnedItem> ownedItems(OwnedItemFilter filter);

  /**
   * Returns the owned artists of a scope.
   *
   * @param scope the scope, never null
   * @return the artists, never null
   */
  List<MusicArtist> artists(Scope scope);

  /**
   * Returns the owned albums of a scope.
   *
   * @param scope the scope, never null
   * @return the albums, never null
   */
  List<MusicAlbum> albums(Scope scope);

  /**
   * Returns the owned albums of an artist.
   *
   * @param artistId the local artist id, never null
   * @return the albums, never null
   */
  List<MusicAlbum> albumsOfArtist(String artistId);

  /**
   * Returns the owned tracks of an album.
   *
   * @param albumId the local album id, never null
   * @return the tracks, never null
   */
  List<MusicTrack> tracksOfAlbum(String albumId);

  /**
   * Inserts or replaces the record of a unit within a scope.
   *
   * @param record the record, never null
   *
   * @throws UncheckedIOException if the write cannot be persisted
   */
  void upsert(CompletenessRecord record);

  /**
   * Reads the record of a unit within a scope.
   *
   * @param type    the record type, never null
   * @param unitKey the unit key, never null
   * @param scope   the scope, never null
   * @param <R>     the record type
   * @return the record, or empty if the unit was never analyzed
   */
  <R extends CompletenessRecord> Optional<R> record(Class<R> type,
      String unitKey, Scope scope);

  /**
   * Lists the records of a type whose scope falls within the given scope.
   *
   * @param type  the record type, never null
   * @param scope the scope, never null
   * @param <R>   the record type
   * @return the records, never null
   */
  <R extends CompletenessRecord> List<R> records(Class<R> type, Scope scope);

  /**
   * Deletes the records of a type whose scope falls within the given scope.
   *
   * @param type  the record type, never null
   * @param scope the scope, never null
   */
  void deleteRecords(Class<? extends CompletenessRecord> type, Scope scope);

  /**
   * Reads a setting.
   *
   * @param key the setting key, never null
   * @return the value, or empty if unset
   */
  Optional<String> setting(String key);

  /**
   * Writes a setting.
   *
   * @param key   the setting key, never null
   * @param value the value, null to remove it
   */
  void putSetting(String key, String value);

  /**
   * Caches the catalog id resolved for an owned movie.
   *
   * @param itemId    the local item id, never null
   * @param catalogId the catalog id, never null
   */
  void updateCatalogId(String itemId, String catalogId);

  /**
   * Caches the catalog id resolved for an artist.
   *
   * @param artistId  the local artist id, never null
   * @param catalogId the catalog id, never null
   */
  void updateArtistCatalogId(String artistId, String catalogId);

  /**
   * Caches the release-group id resolved for an album.
   *
   * @param albumId        the local album id, never null
   * @param releaseGroupId the release-group id, never null
   */
  void updateAlbumCatalogId(String albumId, String releaseGroupId);

  /**
   * Stores artwork resolved for an owned item. Null fields are left
   * untouched.
   *
   * @param itemId  the local item id, never null
   * @param artwork the artwork, never null
   */
  void updateArtwork(String itemId, ArtworkUpdate artwork);

  /**
   * Stores cover art resolved for an album.
   *
   * @param albumId    the local album id, never null
   * @param thumbUrl   the thumbnail, never null
   * @param artworkUrl the full size cover, never null
   */
  void updateAlbumArtwork(String albumId, String thumbUrl,
      String artworkUrl);

  /**
   * Opens a write batch.
   *
   * @throws IllegalStateException if a batch is already open
   */
  void beginWriteBatch();

  /**
   * Flushes pending writes and closes the write batch. Does nothing when
   * no batch is open.
   *
   * @throws UncheckedIOException if the flush fails
   */
  void endWriteBatch();

  /**
   * Flushes pending writes to durable storage.
   *
   * @throws UncheckedIOException if the flush fails
   */
  void forceCheckpoint();
}
