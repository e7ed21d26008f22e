package org.waabox.completist.catalog;

import java.util.List;

/**
 * A TV show and its season list.
 *
 * @param id           the catalog id, never null
 * @param name         the show name, may be null
 * @param status       the production status, such as "Ended", may be null
 * @param posterPath   the poster image path, may be null
 * @param backdropPath the backdrop image path, may be null
 * @param seasons      the seasons, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogShow(String id, String name, String status,
    String posterPath, String backdropPath,
    List<CatalogSeasonSummary> seasons) {

  /** Freezes the season list. */
  public CatalogShow {
    seasons = seasons == null ? List.of() : List.copyOf(seasons);
  }
}
