package org.waabox.completist.model;

import java.util.Objects;

/**
 * A locally owned movie or episode, as reported by a library provider.
 *
 * <p>Owned items are created by library scanning; the completeness engine
 * only reads them, apart from caching resolved catalog ids and artwork.
 *
 * @param id               the local item id, never null
 * @param sourceId         the provider id, never null
 * @param sourceType       the provider kind, never null
 * @param libraryId        the library id within the provider, may be null
 * @param providerItemId   the item id inside the provider, may be null
 * @param kind             movie or episode, never null
 * @param title            the item title, never null
 * @param year             the release year, may be null
 * @param seriesTitle      the series title for episodes, may be null
 * @param seasonNumber     the season number for episodes, may be null
 * @param episodeNumber    the episode number for episodes, may be null
 * @param catalogId        the external catalog id, may be null
 * @param seriesCatalogId  the external catalog id of the series, may be null
 * @param crossReferenceId the industry cross reference id, such as an IMDb
 *                         {@code tt} id, may be null
 * @param qualityProxy     the quality tie-breaker, such as the video bitrate
 * @param posterUrl        the poster known to the provider, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record OwnedItem(
    String id,
    String sourceId,
    SourceType sourceType,
    String libraryId,
    String providerItemId,
    MediaKind kind,
    String title,
    Integer year,
    String seriesTitle,
    Integer seasonNumber,
    Integer episodeNumber,
    String catalogId,
    String seriesCatalogId,
    String crossReferenceId,
    long qualityProxy,
    String posterUrl) {

  /** Validates the mandatory fields. */
  public OwnedItem {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(sourceId, "sourceId must not be null");
    Objects.requireNonNull(sourceType, "sourceType must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(title, "title must not be null");
  }

  /**
   * Creates an owned movie.
   *
   * @param id           the local id, never null
   * @param sourceId     the provider id, never null
   * @param sourceType   the provider kind, never null
   * @param title        the title, never null
   * @param year         the release year, may be null
   * @param catalogId    the catalog id, may be null
   * @param qualityProxy the quality tie-breaker
   * @return the movie, never null
   */
  public static OwnedItem movie(final String id, final String sourceId,
      final SourceType sourceType, final String title, final Integer year,
      final String catalogId, final long qualityProxy) {
    return new OwnedItem(id, sourceId, sourceType, null, null,
        MediaKind.MOVIE, title, year, null, null, null, catalogId, null,
        null, qualityProxy, null);
  }

  /**
   * Creates an owned episode.
   *
   * @param id            the local id, never null
   * @param sourceId      the provider id, never null
   * @param sourceType    the provider kind, never null
   * @param seriesTitle   the series title, never null
   * @param seasonNumber  the season number, never null
   * @param episodeNumber the episode number, never null
   * @param qualityProxy  the quality tie-breaker
   * @return the episode, never null
   */
  public static OwnedItem episode(final String id, final String sourceId,
      final SourceType sourceType, final String seriesTitle,
      final int seasonNumber, final int episodeNumber,
      final long qualityProxy) {
    Objects.requireNonNull(seriesTitle, "seriesTitle must not be null");
    return new OwnedItem(id, sourceId, sourceType, null, null,
        MediaKind.EPISODE, seriesTitle + " S" + seasonNumber + "E"
        + episodeNumber, null, seriesTitle, seasonNumber, episodeNumber,
        null, null, null, qualityProxy, null);
  }

  /**
   * Tells whether the item already carries a catalog id.
   *
   * @return true if the catalog id is known
   */
  public boolean hasCatalogId() {
    return catalogId != null && !catalogId.isBlank();
  }

  /**
   * Tells whether this episode belongs to the specials season.
   *
   * @return true for season 0 episodes
   */
  public boolean special() {
    return seasonNumber != null && seasonNumber == 0;
  }

  /**
   * Returns the season-episode key of this episode, such as
   * {@code S01E02}.
   *
   * @return the key, or null if this is not a numbered episode
   */
  public String episodeKey() {
    if (seasonNumber == null || episodeNumber == null) {
      return null;
    }
    return String.format("S%02dE%02d", seasonNumber, episodeNumber);
  }

  /**
   * Returns a copy with the given catalog id.
   *
   * @param theCatalogId the catalog id, may be null
   * @return the copy, never null
   */
  public OwnedItem withCatalogId(final String theCatalogId) {
    return new OwnedItem(id, sourceId, sourceType, libraryId, providerItemId,
        kind, title, year, seriesTitle, seasonNumber, episodeNumber,
        theCatalogId, seriesCatalogId, crossReferenceId, qualityProxy,
        posterUrl);
  }

  /**
   * Returns a copy with the given series catalog id.
   *
   * @param theSeriesCatalogId the series catalog id, may be null
   * @return the copy, never null
   */
  public OwnedItem withSeriesCatalogId(final String theSeriesCatalogId) {
    return new OwnedItem(id, sourceId, sourceType, libraryId, providerItemId,
        kind, title, year, seriesTitle, seasonNumber, episodeNumber,
        catalogId, theSeriesCatalogId, crossReferenceId, qualityProxy,
        posterUrl);
  }

  /**
   * Returns a copy with the given cross reference id.
   *
   * @param theCrossReferenceId the cross reference id, may be null
   * @return the copy, never null
   */
  public OwnedItem withCrossReferenceId(final String theCrossReferenceId) {
    return new OwnedItem(id, sourceId, sourceType, libraryId, providerItemId,
        kind, title, year, seriesTitle, seasonNumber, episodeNumber,
        catalogId, seriesCatalogId, theCrossReferenceId, qualityProxy,
        posterUrl);
  }

  /**
   * Returns a copy with the given poster.
   *
   * @param thePosterUrl the poster, may be null
   * @return the copy, never null
   */
  public OwnedItem withPosterUrl(final String thePosterUrl) {
    return new OwnedItem(id, sourceId, sourceType, libraryId, providerItemId,
        kind, title, year, seriesTitle, seasonNumber, episodeNumber,
        catalogId, seriesCatalogId, crossReferenceId, qualityProxy,
        thePosterUrl);
  }

  /**
   * Returns a copy placed in the given library.
   *
   * @param theLibraryId the library id, may be null
   * @return the copy, never null
   */
  public OwnedItem inLibrary(final String theLibraryId) {
    return new OwnedItem(id, sourceId, sourceType, theLibraryId,
        providerItemId, kind, title, year, seriesTitle, seasonNumber,
        episodeNumber, catalogId, seriesCatalogId, crossReferenceId,
        qualityProxy, posterUrl);
  }
}
