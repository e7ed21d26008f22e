package org.waabox.completist.store;

import java.util.List;
import java.util.Map;

import org.waabox.completist.model.AlbumCompleteness;
import org.waabox.completist.model.ArtistCompleteness;
import org.waabox.completist.model.CollectionCompleteness;
import org.waabox.completist.model.MusicAlbum;
import org.waabox.completist.model.MusicArtist;
import org.waabox.completist.model.MusicTrack;
import org.waabox.completist.model.OwnedItem;
import org.waabox.completist.model.SeriesCompleteness;

/**
 * A point-in-time copy of everything an {@link InMemoryLibraryStore} holds.
 *
 * <p>Used by persistent stores to save and restore their state.
 *
 * @param ownedItems             the owned movies and episodes
 * @param artists                the owned artists
 * @param albums                 the owned albums
 * @param tracks                 the owned tracks
 * @param settings               the settings
 * @param artwork                the artwork pushed back per item id
 * @param seriesCompleteness     the series records
 * @param collectionCompleteness the collection records
 * @param artistCompleteness     the discography records
 * @param albumCompleteness      the album track records
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record LibraryContents(
    List<OwnedItem> ownedItems,
    List<MusicArtist> artists,
    List<MusicAlbum> albums,
    List<MusicTrack> tracks,
    Map<String, String> settings,
    Map<String, ArtworkUpdate> artwork,
    List<SeriesCompleteness> seriesCompleteness,
    List<CollectionCompleteness> collectionCompleteness,
    List<ArtistCompleteness> artistCompleteness,
    List<AlbumCompleteness> albumCompleteness) {

  /** Replaces missing sections with empty ones and freezes the rest. */
  public LibraryContents {
    ownedItems = ownedItems == null ? List.of() : List.copyOf(ownedItems);
    artists = artists == null ? List.of() : List.copyOf(artists);
    albums = albums == null ? List.of() : List.copyOf(albums);
    tracks = tracks == null ? List.of() : List.copyOf(tracks);
    settings = settings == null ? Map.of() : Map.copyOf(settings);
    artwork = artwork == null ? Map.of() : Map.copyOf(artwork);
    seriesCompleteness = seriesCompleteness == null
        ? List.of() : List.copyOf(seriesCompleteness);
    collectionCompleteness = collectionCompleteness == null
        ? List.of() : List.copyOf(collectionCompleteness);
    artistCompleteness = artistCompleteness == null
        ? List.of() : List.copyOf(artistCompleteness);
    albumCompleteness = albumCompleteness == null
        ? List.of() : List.copyOf(albumCompleteness);
  }

  /**
   * Returns empty contents.
   *
   * @return the empty contents, never null
   */
  public static LibraryContents empty() {
    return new LibraryContents(null, null, null, null, null, null, null,
        null, null, null);
  }
}
