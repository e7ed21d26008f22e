package org.waabox.completist.model;

import java.util.Objects;

/**
 * A locally owned track of an album.
 *
 * @param id          the local track id, never null
 * @param albumId     the local album id, never null
 * @param title       the track title, never null
 * @param trackNumber the position on the disc, may be null
 * @param discNumber  the disc number, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MusicTrack(String id, String albumId, String title,
    Integer trackNumber, Integer discNumber) {

  /** Validates the mandatory fields. */
  public MusicTrack {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(albumId, "albumId must not be null");
    Objects.requireNonNull(title, "title must not be null");
  }
}
