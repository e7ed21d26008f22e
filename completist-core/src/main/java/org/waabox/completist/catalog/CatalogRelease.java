package org.waabox.completist.catalog;

import java.util.List;

/**
 * A concrete release of a release group, with its tracklist.
 *
 * @param releaseGroupId the release-group id, never null
 * @param releaseId      the release id, never null
 * @param title          the title, may be null
 * @param tracks         the tracks over every disc, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogRelease(String releaseGroupId, String releaseId,
    String title, List<CatalogTrack> tracks) {

  /** Freezes the tracklist. */
  public CatalogRelease {
    tracks = tracks == null ? List.of() : List.copyOf(tracks);
  }
}
