package org.waabox.completist.model;

/**
 * A track of an album release that is not owned.
 *
 * @param catalogId   the recording id, may be null
 * @param title       the title, never null
 * @param trackNumber the position on the disc
 * @param discNumber  the disc number
 * @param durationMs  the length in milliseconds, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MissingTrack(String catalogId, String title, int trackNumber,
    int discNumber, Long durationMs) {
}
