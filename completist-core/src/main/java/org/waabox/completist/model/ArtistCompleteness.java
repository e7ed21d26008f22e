package org.waabox.completist.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Completeness of one artist discography.
 *
 * <p>The percentage is weighted by {@link ReleaseType#weight()}: albums
 * count three times, EPs twice and singles once.
 *
 * @param artistName             the artist name, never null
 * @param scope                  the analyzed scope, never null
 * @param catalogId              the artist catalog id, null when unmatched
 * @param totalAlbums            the studio albums in the catalog
 * @param ownedAlbums            the owned studio albums
 * @param totalEps               the EPs in the catalog
 * @param ownedEps               the owned EPs
 * @param totalSingles           the singles in the catalog
 * @param ownedSingles           the owned singles
 * @param missingAlbums          studio albums that are not owned
 * @param missingEps             EPs that are not owned
 * @param missingSingles         singles that are not owned
 * @param completenessPercentage the weighted completeness, within [0, 100]
 * @param ownedItemCount         the owned albums the analysis used
 * @param country                the artist country, may be null
 * @param artistType             the artist type, such as "Group"
 * @param activeYears            the active years, such as "1990-2004"
 * @param thumbUrl               the artist thumbnail, may be null
 * @param updatedAt              when the record was written, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ArtistCompleteness(
    String artistName,
    Scope scope,
    String catalogId,
    int totalAlbums,
    int ownedAlbums,
    int totalEps,
    int ownedEps,
    int totalSingles,
    int ownedSingles,
    List<MissingRelease> missingAlbums,
    List<MissingRelease> missingEps,
    List<MissingRelease> missingSingles,
    int completenessPercentage,
    int ownedItemCount,
    String country,
    String artistType,
    String activeYears,
    String thumbUrl,
    Instant updatedAt) implements CompletenessRecord {

  /** Validates the record and freezes its lists. */
  public ArtistCompleteness {
    Objects.requireNonNull(artistName, "artistName must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    missingAlbums = missingAlbums == null
        ? List.of() : List.copyOf(missingAlbums);
    missingEps = missingEps == null ? List.of() : List.copyOf(missingEps);
    missingSingles = missingSingles == null
        ? List.of() : List.copyOf(missingSingles);
    CompletenessRecord.requireValidPercentage(completenessPercentage);
  }

  /** {@inheritDoc} */
  @Override
  public String unitKey() {
    return artistName;
  }

  /** {@inheritDoc} */
  @Override
  public int totalCount() {
    return totalAlbums + totalEps + totalSingles;
  }

  /** {@inheritDoc} */
  @Override
  public int ownedCount() {
    return ownedAlbums + ownedEps + ownedSingles;
  }

  /** {@inheritDoc} */
  @Override
  public int missingCount() {
    return missingAlbums.size() + missingEps.size() + missingSingles.size();
  }
}
