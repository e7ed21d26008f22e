package org.waabox.completist.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Track completeness of one owned album against a catalog release.
 *
 * @param albumId                the local album id, never null
 * @param artistName             the artist name, never null
 * @param albumTitle             the album title, never null
 * @param scope                  the analyzed scope, never null
 * @param releaseGroupId         the release-group id, null when unmatched
 * @param releaseId              the release the tracklist came from
 * @param totalTracks            the tracks of the release
 * @param ownedTracks            the owned tracks of the release
 * @param missingTracks          tracks that are not owned
 * @param completenessPercentage the completeness, within [0, 100]
 * @param ownedItemCount         the owned tracks the analysis used
 * @param updatedAt              when the record was written, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record AlbumCompleteness(
    String albumId,
    String artistName,
    String albumTitle,
    Scope scope,
    String releaseGroupId,
    String releaseId,
    int totalTracks,
    int ownedTracks,
    List<MissingTrack> missingTracks,
    int completenessPercentage,
    int ownedItemCount,
    Instant updatedAt) implements CompletenessRecord {

  /** Validates the record and freezes its list. */
  public AlbumCompleteness {
    Objects.requireNonNull(albumId, "albumId must not be null");
    Objects.requireNonNull(artistName, "artistName must not be null");
    Objects.requireNonNull(albumTitle, "albumTitle must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    missingTracks = missingTracks == null
        ? List.of() : List.copyOf(missingTracks);
    CompletenessRecord.requireValidPercentage(completenessPercentage);
  }

  /** {@inheritDoc} */
  @Override
  public String unitKey() {
    return albumId;
  }

  /** {@inheritDoc} */
  @Override
  public int totalCount() {
    return totalTracks;
  }

  /** {@inheritDoc} */
  @Override
  public int ownedCount() {
    return ownedTracks;
  }

  /** {@inheritDoc} */
  @Override
  public int missingCount() {
    return missingTracks.size();
  }
}
