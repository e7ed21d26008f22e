package org.waabox.completist.model;

import java.util.Objects;

/**
 * A locally owned music artist.
 *
 * @param id        the local artist id, never null
 * @param sourceId  the provider id, never null
 * @param libraryId the library id, may be null
 * @param name      the artist name, never null
 * @param catalogId the music catalog artist id, may be null
 * @param thumbUrl  the artist thumbnail, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MusicArtist(String id, String sourceId, String libraryId,
    String name, String catalogId, String thumbUrl) {

  /** Validates the mandatory fields. */
  public MusicArtist {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(sourceId, "sourceId must not be null");
    Objects.requireNonNull(name, "name must not be null");
  }

  /**
   * Returns a copy with the given catalog id.
   *
   * @param theCatalogId the catalog id, may be null
   * @return the copy, never null
   */
  public MusicArtist withCatalogId(final String theCatalogId) {
    return new MusicArtist(id, sourceId, libraryId, name, theCatalogId,
        thumbUrl);
  }
}
