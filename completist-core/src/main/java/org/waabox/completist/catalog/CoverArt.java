package org.waabox.completist.catalog;

/**
 * The front cover URLs of a release group.
 *
 * @param thumbUrl   the 500 pixels rendition, never null
 * @param artworkUrl the 1200 pixels rendition, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CoverArt(String thumbUrl, String artworkUrl) {
}
