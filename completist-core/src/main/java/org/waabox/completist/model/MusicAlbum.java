package org.waabox.completist.model;

import java.util.Objects;

/**
 * A locally owned music album.
 *
 * @param id         the local album id, never null
 * @param sourceId   the provider id, never null
 * @param sourceType the provider kind, never null
 * @param libraryId  the library id, may be null
 * @param artistId   the local artist id, may be null
 * @param artistName the artist name, never null
 * @param title      the album title, never null
 * @param year       the release year, may be null
 * @param catalogId  the music catalog release-group id, may be null
 * @param releaseId  the music catalog release id, may be null
 * @param thumbUrl   the cover thumbnail, may be null
 * @param artworkUrl the full size cover, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MusicAlbum(String id, String sourceId, SourceType sourceType,
    String libraryId, String artistId, String artistName, String title,
    Integer year, String catalogId, String releaseId, String thumbUrl,
    String artworkUrl) {

  /** Validates the mandatory fields. */
  public MusicAlbum {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(sourceId, "sourceId must not be null");
    Objects.requireNonNull(sourceType, "sourceType must not be null");
    Objects.requireNonNull(artistName, "artistName must not be null");
    Objects.requireNonNull(title, "title must not be null");
  }

  /**
   * Tells whether the album has any cover art.
   *
   * @return true if a thumbnail or a full size cover is known
   */
  public boolean hasArtwork() {
    return thumbUrl != null || artworkUrl != null;
  }

  /**
   * Returns a copy with the given catalog id.
   *
   * @param theCatalogId the release-group id, may be null
   * @return the copy, never null
   */
  public MusicAlbum withCatalogId(final String theCatalogId) {
    return new MusicAlbum(id, sourceId, sourceType, libraryId, artistId,
        artistName, title, year, theCatalogId, releaseId, thumbUrl,
        artworkUrl);
  }

  /**
   * Returns a copy with the given artwork.
   *
   * @param theThumbUrl   the thumbnail, may be null
   * @param theArtworkUrl the full size cover, may be null
   * @return the copy, never null
   */
  public MusicAlbum withArtwork(final String theThumbUrl,
      final String theArtworkUrl) {
    return new MusicAlbum(id, sourceId, sourceType, libraryId, artistId,
        artistName, title, year, catalogId, releaseId, theThumbUrl,
        theArtworkUrl);
  }
}
