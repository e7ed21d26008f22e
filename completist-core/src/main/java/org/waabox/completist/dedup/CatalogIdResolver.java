package org.waabox.completist.dedup;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.catalog.CatalogSearchResult;
import org.waabox.completist.catalog.VideoCatalog;
import org.waabox.completist.http.CatalogException;
import org.waabox.completist.model.OwnedItem;

/**
 * Resolves the catalog id of owned movies and series that lack one.
 *
 * <p>The lookups run in order, falling through on a miss or a catalog
 * failure:
 * <ol>
 *   <li>the id already carried by the item;</li>
 *   <li>the IMDb cross reference, looked up through the catalog's
 *       external id endpoint;</li>
 *   <li>a title search, taking the result with the exact year or else the
 *       top one.</li>
 * </ol>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CatalogIdResolver {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CatalogIdResolver.class);

  /** The prefix of IMDb ids. */
  private static final String IMDB_PREFIX = "tt";

  /** The video catalog, never null. */
  private final VideoCatalog catalog;

  /**
   * Creates a new resolver.
   *
   * @param theCatalog the video catalog, never null
   */
  public CatalogIdResolver(final VideoCatalog theCatalog) {
    catalog = Objects.requireNonNull(theCatalog, "catalog must not be null");
  }

  /**
   * Resolves the catalog id of a movie.
   *
   * @param movie the owned movie, never null
   * @return the catalog id, or empty if every lookup missed
   */
  public Optional<String> resolveMovie(final OwnedItem movie) {
    Objects.requireNonNull(movie, "movie must not be null");
    if (movie.hasCatalogId()) {
      return Optional.of(movie.catalogId());
    }

    if (isImdbId(movie.crossReferenceId())) {
      try {
        final List<String> ids = catalog.findByImdbId(
            movie.crossReferenceId()).movieIds();
        if (!ids.isEmpty()) {
          log.debug("Resolved movie '{}' by IMDb id {}", movie.title(),
              movie.crossReferenceId());
          return Optional.of(ids.get(0));
        }
      } catch (final CatalogException e) {
        log.warn("IMDb lookup failed for movie '{}': {}", movie.title(),
            e.getMessage());
      }
    }

    try {
      final List<CatalogSearchResult> results = catalog.searchMovies(
          movie.title(), movie.year());
      final Optional<String> id = pick(results, movie.year());
      if (id.isPresent()) {
        log.debug("Resolved movie '{}' by title search", movie.title());
      } else {
        log.debug("No catalog match for movie '{}'", movie.title());
      }
      return id;
    } catch (final CatalogException e) {
      log.warn("Title search failed for movie '{}': {}", movie.title(),
          e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Resolves the catalog id of a series from its owned episodes.
   *
   * @param title    the series title, never null
   * @param episodes the owned episodes of the series, never null
   * @return the show catalog id, or empty if every lookup missed
   */
  public Optional<String> resolveShow(final String title,
      final List<OwnedItem> episodes) {
    Objects.requireNonNull(title, "title must not be null");
    Objects.requireNonNull(episodes, "episodes must not be null");

    for (final OwnedItem episode : episodes) {
      final String known = episode.seriesCatalogId();
      if (known != null && !known.isBlank()) {
        return Optional.of(known);
      }
    }

    final Optional<String> imdbId = episodes.stream()
        .map(OwnedItem::crossReferenceId)
        .filter(CatalogIdResolver::isImdbId)
        .findFirst();
    if (imdbId.isPresent()) {
      try {
        final List<String> ids = catalog.findByImdbId(imdbId.get())
            .showIds();
        if (!ids.isEmpty()) {
          log.debug("Resolved series '{}' by IMDb id {}", title,
              imdbId.get());
          return Optional.of(ids.get(0));
        }
      } catch (final CatalogException e) {
        log.warn("IMDb lookup failed for series '{}': {}", title,
            e.getMessage());
      }
    }

    try {
      final List<CatalogSearchResult> results = catalog.searchShows(title);
      if (results.isEmpty()) {
        log.debug("No catalog match for series '{}'", title);
        return Optional.empty();
      }
      return Optional.ofNullable(results.get(0).id());
    } catch (final CatalogException e) {
      log.warn("Title search failed for series '{}': {}", title,
          e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Picks the first result with the exact year, or else the top one.
   *
   * @param results the search results, never null
   * @param year    the wanted year, may be null
   * @return the chosen id, or empty if there are no results
   */
  private static Optional<String> pick(
      final List<CatalogSearchResult> results, final Integer year) {
    if (results.isEmpty()) {
      return Optional.empty();
    }
    if (year != null) {
      for (final CatalogSearchResult result : results) {
        if (year.equals(result.year())) {
          return Optional.ofNullable(result.id());
        }
      }
    }
    return Optional.ofNullable(results.get(0).id());
  }

  /**
   * Tells whether a cross reference is an IMDb id.
   *
   * @param crossReferenceId the cross reference, may be null
   * @return true if it looks like an IMDb id
   */
  private static boolean isImdbId(final String crossReferenceId) {
    return crossReferenceId != null
        && crossReferenceId.startsWith(IMDB_PREFIX);
  }
}
