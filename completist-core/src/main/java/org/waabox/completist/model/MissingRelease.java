package org.waabox.completist.model;

/**
 * A release group of an artist that is not owned.
 *
 * @param catalogId the release-group id, never null
 * @param title     the title, may be null
 * @param year      the first release year, may be null
 * @param type      album, EP or single, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MissingRelease(String catalogId, String title, Integer year,
    ReleaseType type) {
}
