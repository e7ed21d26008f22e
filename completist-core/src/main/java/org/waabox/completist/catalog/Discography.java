package org.waabox.completist.catalog;

import java.util.List;
import java.util.Objects;

/**
 * An artist and every release group credited to it.
 *
 * @param artist        the artist, never null
 * @param releaseGroups the release groups, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Discography(CatalogArtist artist,
    List<ReleaseGroup> releaseGroups) {

  /** Validates the artist and freezes the release groups. */
  public Discography {
    Objects.requireNonNull(artist, "artist must not be null");
    releaseGroups = releaseGroups == null
        ? List.of() : List.copyOf(releaseGroups);
  }
}
