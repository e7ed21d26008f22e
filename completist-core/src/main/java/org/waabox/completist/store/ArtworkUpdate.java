package org.waabox.completist.store;

/**
 * Artwork resolved from a catalog for an owned item of a local provider.
 *
 * @param posterUrl       the movie or show poster, may be null
 * @param thumbUrl        the episode still, may be null
 * @param seasonPosterUrl the season poster, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ArtworkUpdate(String posterUrl, String thumbUrl,
    String seasonPosterUrl) {

  /**
   * Creates an update carrying only a poster.
   *
   * @param posterUrl the poster, never null
   * @return the update, never null
   */
  public static ArtworkUpdate poster(final String posterUrl) {
    return new ArtworkUpdate(posterUrl, null, null);
  }
}
