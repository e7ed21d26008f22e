package org.waabox.completist.tmdb;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.MissingCredentialsException;
import org.waabox.completist.cache.ResponseCache;
import org.waabox.completist.catalog.CatalogCollection;
import org.waabox.completist.catalog.CatalogEpisode;
import org.waabox.completist.catalog.CatalogMovie;
import org.waabox.completist.catalog.CatalogSearchResult;
import org.waabox.completist.catalog.CatalogSeason;
import org.waabox.completist.catalog.CatalogSeasonSummary;
import org.waabox.completist.catalog.CatalogShow;
import org.waabox.completist.catalog.ExternalIdMatches;
import org.waabox.completist.catalog.ImageSize;
import org.waabox.completist.catalog.VideoCatalog;
import org.waabox.completist.http.CatalogHttpClient;
import org.waabox.completist.http.CatalogHttpConfig;
import org.waabox.completist.metrics.CompletistMetrics;
import org.waabox.completist.ratelimit.RateLimiters;
import org.waabox.completist.store.LibraryStore;

/**
 * {@link VideoCatalog} backed by The Movie Database (TMDB) v3 API.
 *
 * <p>Requests go through a {@link CatalogHttpClient} limited to 40 requests
 * per second, with a 24 hour response cache. The API key is sent as the
 * {@code api_key} query parameter; it never takes part in cache keys or
 * logs. When the configuration carries no key, the {@code tmdb_api_key}
 * store setting is read on every request, so a key saved after start-up is
 * picked up without a restart.
 *
 * <p>Payload fields TMDB omits are mapped to null or empty values.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TmdbCatalog implements VideoCatalog {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      TmdbCatalog.class);

  /** The store setting holding the API key. */
  public static final String API_KEY_SETTING = "tmdb_api_key";

  /** The catalog name used in logs and metrics. */
  static final String NAME = "tmdb";

  /** The configuration, never null. */
  private final TmdbConfig config;

  /** The store used to read the API key setting, never null. */
  private final LibraryStore store;

  /** The HTTP client, never null. */
  private final CatalogHttpClient client;

  /**
   * Creates a TMDB catalog with the standard rate limiter.
   *
   * @param theConfig  the configuration, never null
   * @param theStore   the store holding the API key setting, never null
   * @param theMetrics the metrics reporter, never null
   */
  public TmdbCatalog(final TmdbConfig theConfig, final LibraryStore theStore,
      final CompletistMetrics theMetrics) {
    this(theConfig, theStore, new CatalogHttpClient(httpConfig(theConfig),
        RateLimiters.video(), Clock.systemUTC(), theMetrics));
  }

  /**
   * Creates a TMDB catalog over an existing client.
   *
   * @param theConfig the configuration, never null
   * @param theStore  the store holding the API key setting, never null
   * @param theClient the HTTP client, never null
   */
  public TmdbCatalog(final TmdbConfig theConfig, final LibraryStore theStore,
      final CatalogHttpClient theClient) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    store = Objects.requireNonNull(theStore, "store must not be null");
    client = Objects.requireNonNull(theClient, "client must not be null");
  }

  /**
   * Maps a TMDB configuration to the HTTP client configuration.
   *
   * @param config the TMDB configuration, never null
   * @return the HTTP configuration, never null
   */
  static CatalogHttpConfig httpConfig(final TmdbConfig config) {
    Objects.requireNonNull(config, "config must not be null");
    return CatalogHttpConfig.builder(NAME, config.baseUrl())
        .timeout(config.timeout())
        .maxInFlight(config.maxInFlight())
        .cacheTtl(config.cacheTtl())
        .build();
  }

  @Override
  public void verifyCredentials() {
    apiKey();
  }

  @Override
  public CatalogMovie movie(final String movieId) {
    Objects.requireNonNull(movieId, "movieId must not be null");
    return toMovie(get("/movie/" + movieId, Map.of()), null, null);
  }

  @Override
  public CatalogCollection collection(final String collectionId) {
    Objects.requireNonNull(collectionId, "collectionId must not be null");
    final JsonNode node = get("/collection/" + collectionId, Map.of());
    final String name = text(node, "name");

    final List<CatalogMovie> parts = new ArrayList<>();
    for (final JsonNode part : node.path("parts")) {
      parts.add(toMovie(part, collectionId, name));
    }
    return new CatalogCollection(collectionId, name,
        text(node, "poster_path"), text(node, "backdrop_path"), parts);
  }

  @Override
  public CatalogShow show(final String showId) {
    Objects.requireNonNull(showId, "showId must not be null");
    return toShow(showId, get("/tv/" + showId, Map.of()));
  }

  @Override
  public List<CatalogSeason> seasons(final String showId,
      final List<Integer> seasonNumbers) {
    Objects.requireNonNull(showId, "showId must not be null");
    Objects.requireNonNull(seasonNumbers, "seasonNumbers must not be null");
    if (seasonNumbers.size() > MAX_SEASONS_PER_CALL) {
      throw new IllegalArgumentException("At most " + MAX_SEASONS_PER_CALL
          + " seasons per call, got: " + seasonNumbers.size());
    }
    if (seasonNumbers.isEmpty()) {
      return List.of();
    }

    final String append = seasonNumbers.stream()
        .map(number -> "season/" + number)
        .collect(Collectors.joining(","));
    final JsonNode node = get("/tv/" + showId,
        Map.of("append_to_response", append));

    final List<CatalogSeason> seasons = new ArrayList<>();
    for (final Integer number : seasonNumbers) {
      final JsonNode season = node.get("season/" + number);
      if (season == null || season.isNull()) {
        log.debug("TMDB show {} did not return season {}", showId, number);
        continue;
      }
      seasons.add(toSeason(season, number));
    }
    return seasons;
  }

  @Override
  public CatalogSeason season(final String showId, final int seasonNumber) {
    Objects.requireNonNull(showId, "showId must not be null");
    return toSeason(get("/tv/" + showId + "/season/" + seasonNumber,
        Map.of()), seasonNumber);
  }

  @Override
  public List<CatalogSearchResult> searchMovies(final String title,
      final Integer year) {
    Objects.requireNonNull(title, "title must not be null");
    final Map<String, String> params = new LinkedHashMap<>();
    params.put("query", title);
    if (year != null) {
      params.put("year", year.toString());
    }
    final JsonNode node = get("/search/movie", params);

    final List<CatalogSearchResult> results = new ArrayList<>();
    for (final JsonNode hit : node.path("results")) {
      results.add(new CatalogSearchResult(hit.path("id").asText(),
          text(hit, "title"), year(date(hit, "release_date"))));
    }
    return results;
  }

  @Override
  public List<CatalogSearchResult> searchShows(final String title) {
    Objects.requireNonNull(title, "title must not be null");
    final JsonNode node = get("/search/tv", Map.of("query", title));

    final List<CatalogSearchResult> results = new ArrayList<>();
    for (final JsonNode hit : node.path("results")) {
      results.add(new CatalogSearchResult(hit.path("id").asText(),
          text(hit, "name"), year(date(hit, "first_air_date"))));
    }
    return results;
  }

  @Override
  public ExternalIdMatches findByImdbId(final String imdbId) {
    Objects.requireNonNull(imdbId, "imdbId must not be null");
    final JsonNode node = get("/find/" + imdbId,
        Map.of("external_source", "imdb_id"));

    final List<String> movieIds = new ArrayList<>();
    for (final JsonNode hit : node.path("movie_results")) {
      movieIds.add(hit.path("id").asText());
    }
    final List<String> showIds = new ArrayList<>();
    for (final JsonNode hit : node.path("tv_results")) {
      showIds.add(hit.path("id").asText());
    }
    // An episode IMDb id still identifies its show.
    for (final JsonNode hit : node.path("tv_episode_results")) {
      final String showId = text(hit, "show_id");
      if (showId != null && !showIds.contains(showId)) {
        showIds.add(showId);
      }
    }
    return new ExternalIdMatches(movieIds, showIds);
  }

  @Override
  public String imageUrl(final String path, final ImageSize size) {
    Objects.requireNonNull(size, "size must not be null");
    if (path == null || path.isEmpty()) {
      return null;
    }
    return config.imageBaseUrl() + size.code() + path;
  }

  /** Clears the response cache. */
  public void clearCache() {
    client.clearCache();
  }

  /**
   * Returns the response cache statistics.
   *
   * @return the statistics, never null
   */
  public ResponseCache.Stats cacheStats() {
    return client.cacheStats();
  }

  // -----------------------------------------------------------------------
  // Internals
  // -----------------------------------------------------------------------

  /**
   * Fetches an endpoint with the API key.
   *
   * @param endpoint the endpoint path, never null
   * @param params   the query parameters, never null
   * @return the body, never null
   */
  private JsonNode get(final String endpoint,
      final Map<String, String> params) {
    return client.fetch(endpoint, params, Map.of("api_key", apiKey()));
  }

  /**
   * Resolves the API key: the configured one first, then the store
   * setting.
   *
   * @return the key, never null
   *
   * @throws MissingCredentialsException if neither is set
   */
  private String apiKey() {
    if (config.apiKey().isPresent()) {
      return config.apiKey().get();
    }
    return store.setting(API_KEY_SETTING)
        .map(String::trim)
        .filter(key -> !key.isEmpty())
        .orElseThrow(() -> new MissingCredentialsException(
            "TMDB API key not configured"));
  }

  /**
   * Maps a movie payload.
   *
   * @param node           the payload, never null
   * @param collectionId   the enclosing collection id, may be null
   * @param collectionName the enclosing collection name, may be null
   * @return the movie, never null
   */
  private static CatalogMovie toMovie(final JsonNode node,
      final String collectionId, final String collectionName) {
    String resolvedId = collectionId;
    String resolvedName = collectionName;
    final JsonNode belongsTo = node.path("belongs_to_collection");
    if (resolvedId == null && belongsTo.isObject()) {
      resolvedId = text(belongsTo, "id");
      resolvedName = text(belongsTo, "name");
    }
    return new CatalogMovie(node.path("id").asText(), text(node, "title"),
        date(node, "release_date"), text(node, "poster_path"), resolvedId,
        resolvedName);
  }

  /**
   * Maps a show payload.
   *
   * @param showId the requested show id, never null
   * @param node   the payload, never null
   * @return the show, never null
   */
  private static CatalogShow toShow(final String showId, final JsonNode node) {
    final List<CatalogSeasonSummary> seasons = new ArrayList<>();
    for (final JsonNode season : node.path("seasons")) {
      seasons.add(new CatalogSeasonSummary(
          season.path("season_number").asInt(),
          date(season, "air_date"),
          season.path("episode_count").asInt(),
          text(season, "poster_path")));
    }
    final String id = node.hasNonNull("id") ? node.get("id").asText() : showId;
    return new CatalogShow(id, text(node, "name"), text(node, "status"),
        text(node, "poster_path"), text(node, "backdrop_path"), seasons);
  }

  /**
   * Maps a season payload.
   *
   * @param node   the payload, never null
   * @param number the requested season number
   * @return the season, never null
   */
  private static CatalogSeason toSeason(final JsonNode node,
      final int number) {
    final int seasonNumber = node.path("season_number").asInt(number);
    final List<CatalogEpisode> episodes = new ArrayList<>();
    for (final JsonNode episode : node.path("episodes")) {
      episodes.add(new CatalogEpisode(
          episode.path("season_number").asInt(seasonNumber),
          episode.path("episode_number").asInt(),
          text(episode, "name"),
          date(episode, "air_date"),
          text(episode, "still_path")));
    }
    return new CatalogSeason(seasonNumber, date(node, "air_date"),
        text(node, "poster_path"), episodes);
  }

  /**
   * Reads a textual field.
   *
   * @param node  the object, never null
   * @param field the field name, never null
   * @return the text, or null if the field is missing, null or empty
   */
  private static String text(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    final String text = value.asText();
    return text.isEmpty() ? null : text;
  }

  /**
   * Reads an ISO date field. TMDB sends an empty string for unknown dates.
   *
   * @param node  the object, never null
   * @param field the field name, never null
   * @return the date, or null if it is missing or not a date
   */
  private static LocalDate date(final JsonNode node, final String field) {
    final String text = text(node, field);
    if (text == null) {
      return null;
    }
    try {
      return LocalDate.parse(text);
    } catch (final DateTimeParseException e) {
      log.debug("Ignoring unparseable TMDB date '{}' in {}", text, field);
      return null;
    }
  }

  /**
   * Returns the year of a date.
   *
   * @param date the date, may be null
   * @return the year, or null
   */
  private static Integer year(final LocalDate date) {
    return date == null ? null : date.getYear();
  }
}
