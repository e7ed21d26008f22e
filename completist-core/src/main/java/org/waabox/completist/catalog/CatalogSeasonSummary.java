package org.waabox.completist.catalog;

import java.time.LocalDate;

/**
 * A season as listed in a show description, without its episodes.
 *
 * @param seasonNumber the season number, 0 for specials
 * @param airDate      the first air date, null when unknown
 * @param episodeCount the announced number of episodes
 * @param posterPath   the season poster path, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogSeasonSummary(int seasonNumber, LocalDate airDate,
    int episodeCount, String posterPath) {
}
