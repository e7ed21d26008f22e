package org.waabox.completist.model;

/**
 * A released collection member that is not owned.
 *
 * @param catalogId the movie catalog id, never null
 * @param title     the title, may be null
 * @param year      the release year, may be null
 * @param posterUrl the poster, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MissingMovie(String catalogId, String title, Integer year,
    String posterUrl) {
}
