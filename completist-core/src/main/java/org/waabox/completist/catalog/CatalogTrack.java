package org.waabox.completist.catalog;

/**
 * A track of a release.
 *
 * @param recordingId the recording id, may be null
 * @param title       the title, never null
 * @param position    the position on the disc
 * @param discNumber  the disc number
 * @param lengthMs    the length in milliseconds, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CatalogTrack(String recordingId, String title, int position,
    int discNumber, Long lengthMs) {
}
