package org.waabox.completist.catalog;

/**
 * An artist as described by the music catalog.
 *
 * @param id            the artist id, never null
 * @param name          the artist name, never null
 * @param country       the country code, may be null
 * @param type          the artist type, such as "Group", may be null
 * @param lifeSpanBegin the begin date of the life span, may be null
 * @param lifeSpanEnd   the end date of the life span, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogArtist(String id, String name, String country,
    String type, String lifeSpanBegin, String lifeSpanEnd) {

  /**
   * Formats the active years, such as {@code 1990-2004} or
   * {@code 1990-present}.
   *
   * @return the active years, or null if the begin date is unknown
   */
  public String activeYears() {
    if (lifeSpanBegin == null || lifeSpanBegin.length() < 4) {
      return null;
    }
    final String end = lifeSpanEnd == null || lifeSpanEnd.length() < 4
        ? "present"
        : lifeSpanEnd.substring(0, 4);
    return lifeSpanBegin.substring(0, 4) + "-" + end;
  }
}
