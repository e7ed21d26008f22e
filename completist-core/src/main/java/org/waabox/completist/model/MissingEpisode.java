package org.waabox.completist.model;

import java.time.LocalDate;

/**
 * A released episode that is not owned.
 *
 * @param seasonNumber  the season number
 * @param episodeNumber the episode number
 * @param title         the episode title, may be null
 * @param airDate       the original air date, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MissingEpisode(int seasonNumber, int episodeNumber,
    String title, LocalDate airDate) {
}
