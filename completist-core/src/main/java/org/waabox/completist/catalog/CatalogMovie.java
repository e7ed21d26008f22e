package org.waabox.completist.catalog;

import java.time.LocalDate;

/**
 * A movie as described by the film/TV catalog.
 *
 * @param id             the catalog id, never null
 * @param title          the title, may be null
 * @param releaseDate    the release date, null when unknown
 * @param posterPath     the poster image path, may be null
 * @param collectionId   the collection the movie belongs to, may be null
 * @param collectionName the collection name, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogMovie(String id, String title, LocalDate releaseDate,
    String posterPath, String collectionId, String collectionName) {

  /**
   * Returns the release year.
   *
   * @return the year, or null if the release date is unknown
   */
  public Integer year() {
    return releaseDate == null ? null : releaseDate.getYear();
  }
}
