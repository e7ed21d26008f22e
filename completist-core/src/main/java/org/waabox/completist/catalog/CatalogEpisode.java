package org.waabox.completist.catalog;

import java.time.LocalDate;

/**
 * An episode of a season.
 *
 * @param seasonNumber  the season number
 * @param episodeNumber the episode number
 * @param name          the episode title, may be null
 * @param airDate       the air date, null when unknown
 * @param stillPath     the episode still image path, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogEpisode(int seasonNumber, int episodeNumber,
    String name, LocalDate airDate, String stillPath) {
}
