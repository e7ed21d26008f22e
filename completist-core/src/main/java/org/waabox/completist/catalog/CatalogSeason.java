package org.waabox.completist.catalog;

import java.time.LocalDate;
import java.util.List;

/**
 * A season with its episodes.
 *
 * @param seasonNumber the season number
 * @param airDate      the first air date, null when unknown
 * @param posterPath   the season poster path, may be null
 * @param episodes     the episodes, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogSeason(int seasonNumber, LocalDate airDate,
    String posterPath, List<CatalogEpisode> episodes) {

  /** Freezes the episode list. */
  public CatalogSeason {
    episodes = episodes == null ? List.of() : List.copyOf(episodes);
  }
}
