package org.waabox.completist.catalog;

import java.time.LocalDate;
import java.util.List;

/**
 * A release group: every edition of one album, EP or single.
 *
 * <p>MusicBrainz dates are partial. When the catalog gives a day or a month
 * the first release date is set, a month-only date standing for the first
 * day of that month; when it gives a year only, just the year is known.
 *
 * @param id               the release-group id, never null
 * @param title            the title, may be null
 * @param primaryType      the primary type, such as "Album", may be null
 * @param secondaryTypes   the secondary types, such as "Live", never null
 * @param firstReleaseYear the year of the first release, may be null
 * @param firstReleaseDate the date of the first release, null when only the
 *                         year or nothing is known
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ReleaseGroup(String id, String title, String primaryType,
    List<String> secondaryTypes, Integer firstReleaseYear,
    LocalDate firstReleaseDate) {

  /** Freezes the secondary types and derives the year from the date. */
  public ReleaseGroup {
    secondaryTypes = secondaryTypes == null
        ? List.of() : List.copyOf(secondaryTypes);
    if (firstReleaseDate != null) {
      firstReleaseYear = firstReleaseDate.getYear();
    }
  }

  /**
   * Creates a release group whose first release is only known by year.
   *
   * @param id               the release-group id, never null
   * @param title            the title, may be null
   * @param primaryType      the primary type, may be null
   * @param secondaryTypes   the secondary types, may be null
   * @param firstReleaseYear the year of the first release, may be null
   */
  public ReleaseGroup(final String id, final String title,
      final String primaryType, final List<String> secondaryTypes,
      final Integer firstReleaseYear) {
    this(id, title, primaryType, secondaryTypes, firstReleaseYear, null);
  }
}
