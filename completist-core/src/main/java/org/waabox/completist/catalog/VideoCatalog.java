package org.waabox.completist.catalog;

import java.util.List;

import org.waabox.completist.MissingCredentialsException;
import org.waabox.completist.http.CatalogException;

/**
 * The authoritative film/TV catalog.
 *
 * <p>Every lookup may throw a {@link CatalogException}. Payload fields the
 * catalog omits come back as null or empty values, never as errors.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface VideoCatalog {

  /** The maximum number of seasons fetched by one {@link #seasons} call. */
  int MAX_SEASONS_PER_CALL = 20;

  /**
   * Fails fast when the catalog credentials are not configured.
   *
   * @throws MissingCredentialsException if the credentials are missing
   */
  void verifyCredentials();

  /**
   * Fetches a movie.
   *
   * @param movieId the movie id, never null
   * @return the movie, never null
   */
  CatalogMovie movie(String movieId);

  /**
   * Fetches a collection with its members.
   *
   * @param collectionId the collection id, never null
   * @return the collection, never null
   */
  CatalogCollection collection(String collectionId);

  /**
   * Fetches a show with its season list.
   *
   * @param showId the show id, never null
   * @return the show, never null
   */
  CatalogShow show(String showId);

  /**
   * Fetches several seasons of a show in a single round trip.
   *
   * <p>Seasons the catalog does not return are absent from the result.
   *
   * @param showId        the show id, never null
   * @param seasonNumbers at most {@link #MAX_SEASONS_PER_CALL} season
   *                      numbers, never null
   * @return the seasons found, never null
   *
   * @throws IllegalArgumentException if too many seasons are requested
   */
  List<CatalogSeason> seasons(String showId, List<Integer> seasonNumbers);

  /**
   * Fetches one season of a show.
   *
   * @param showId       the show id, never null
   * @param seasonNumber the season number
   * @return the season, never null
   */
  CatalogSeason season(String showId, int seasonNumber);

  /**
   * Searches movies by title.
   *
   * @param title the title, never null
   * @param year  the release year, may be null
   * @return the hits, best first, never null
   */
  List<CatalogSearchResult> searchMovies(String title, Integer year);

  /**
   * Searches shows by title.
   *
   * @param title the title, never null
   * @return the hits, best first, never null
   */
  List<CatalogSearchResult> searchShows(String title);

  /**
   * Finds the entities matching an IMDb id.
   *
   * @param imdbId the IMDb id, such as {@code tt0903747}, never null
   * @return the matches, never null
   */
  ExternalIdMatches findByImdbId(String imdbId);

  /**
   * Builds the URL of an image.
   *
   * @param path the image path returned by the catalog, may be null
   * @param size the rendition, never null
   * @return the URL, or null if the path is null
   */
  String imageUrl(String path, ImageSize size);
}
