package org.waabox.completist.catalog;

import java.util.Optional;

import org.waabox.completist.http.CatalogException;

/**
 * The authoritative music catalog.
 *
 * <p>Every lookup may throw a {@link CatalogException}. Payload fields the
 * catalog omits come back as null or empty values, never as errors.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface MusicCatalog {

  /**
   * Fails fast when the catalog is not usable, for instance when a
   * mandatory client identification is missing. No-op by default.
   */
  default void verifyCredentials() {
  }

  /**
   * Searches an artist by name, preferring an exact case-insensitive match
   * over the top hit.
   *
   * @param name the artist name, never null
   * @return the artist, or empty if nothing matched
   */
  Optional<CatalogArtist> searchArtist(String name);

  /**
   * Fetches an artist with its release groups.
   *
   * @param artistId the artist id, never null
   * @return the discography, never null
   */
  Discography discography(String artistId);

  /**
   * Checks whether a release group has at least one release on a digital
   * or CD-like medium, as opposed to vinyl only.
   *
   * @param releaseGroupId the release-group id, never null
   * @return true if some release is not vinyl only
   */
  boolean hasDigitalRelease(String releaseGroupId);

  /**
   * Fetches the tracklist of the first official release of a release
   * group.
   *
   * @param releaseGroupId the release-group id, never null
   * @return the release, or empty if no release has media
   */
  Optional<CatalogRelease> tracklist(String releaseGroupId);

  /**
   * Searches a release group by artist and album title.
   *
   * @param artistName the artist name, never null
   * @param albumTitle the album title, never null
   * @return the best hit, or empty if nothing matched
   */
  Optional<ReleaseGroup> searchReleaseGroup(String artistName,
      String albumTitle);

  /**
   * Looks up the front cover of a release group.
   *
   * @param releaseGroupId the release-group id, never null
   * @return the cover URLs, or empty if there is no cover
   */
  Optional<CoverArt> coverArt(String releaseGroupId);
}
