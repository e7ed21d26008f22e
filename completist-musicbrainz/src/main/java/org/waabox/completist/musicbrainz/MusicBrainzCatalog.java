package org.waabox.completist.musicbrainz;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.catalog.CatalogArtist;
import org.waabox.completist.catalog.CatalogRelease;
import org.waabox.completist.catalog.CatalogTrack;
import org.waabox.completist.catalog.CoverArt;
import org.waabox.completist.catalog.Discography;
import org.waabox.completist.catalog.MusicCatalog;
import org.waabox.completist.catalog.ReleaseGroup;
import org.waabox.completist.http.CatalogHttpClient;
import org.waabox.completist.http.CatalogHttpConfig;
import org.waabox.completist.http.RetryingCatalogHttpClient;
import org.waabox.completist.metrics.CompletistMetrics;
import org.waabox.completist.ratelimit.RateLimiters;
import org.waabox.completist.ratelimit.Sleeper;

/**
 * {@link MusicCatalog} backed by the MusicBrainz web service and the Cover
 * Art Archive.
 *
 * <p>MusicBrainz allows one request per second per client, so requests are
 * spaced 1.5 seconds apart and retried with exponential backoff on 429 and
 * 5xx answers. Every request carries the configured User-Agent and asks
 * for JSON. Cover art probes are plain HEAD requests outside the rate
 * limiter and the cache.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MusicBrainzCatalog implements MusicCatalog {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      MusicBrainzCatalog.class);

  /** The catalog name used in logs and metrics. */
  static final String NAME = "musicbrainz";

  /** Media formats that count as a digital or CD-like release. */
  private static final List<String> DIGITAL_FORMATS = List.of(
      "cd", "digital media", "enhanced cd", "cd-r", "hdcd", "dualdisc",
      "sacd", "hybrid sacd", "shm-cd", "blu-spec cd", "blu-spec cd2",
      "usb flash drive", "slotmusic", "umd", "cassette", "8cm cd");

  /** Media formats that count as vinyl. */
  private static final List<String> VINYL_FORMATS = List.of(
      "vinyl", "7\" vinyl", "10\" vinyl", "12\" vinyl", "flexi-disc",
      "shellac", "acetate", "lathe cut");

  /** The cover art probe answers meaning that a front cover exists. */
  private static final List<Integer> COVER_FOUND = List.of(200, 302, 307);

  /** The configuration, never null. */
  private final MusicBrainzConfig config;

  /** The HTTP client, never null. */
  private final CatalogHttpClient client;

  /**
   * Creates a MusicBrainz catalog with the standard rate limiter and the
   * configured retry policy.
   *
   * @param theConfig  the configuration, never null
   * @param theMetrics the metrics reporter, never null
   */
  public MusicBrainzCatalog(final MusicBrainzConfig theConfig,
      final CompletistMetrics theMetrics) {
    this(theConfig, new RetryingCatalogHttpClient(httpConfig(theConfig),
        RateLimiters.music(), Clock.systemUTC(), theMetrics,
        theConfig.retryPolicy(), Sleeper.system()));
  }

  /**
   * Creates a MusicBrainz catalog over an existing client.
   *
   * @param theConfig the configuration, never null
   * @param theClient the HTTP client, never null
   */
  public MusicBrainzCatalog(final MusicBrainzConfig theConfig,
      final CatalogHttpClient theClient) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    client = Objects.requireNonNull(theClient, "client must not be null");
  }

  /**
   * Maps a MusicBrainz configuration to the HTTP client configuration.
   *
   * @param config the MusicBrainz configuration, never null
   * @return the HTTP configuration, never null
   */
  static CatalogHttpConfig httpConfig(final MusicBrainzConfig config) {
    Objects.requireNonNull(config, "config must not be null");
    return CatalogHttpConfig.builder(NAME, config.baseUrl())
        .header("User-Agent", config.userAgent())
        .defaultParam("fmt", "json")
        .timeout(config.timeout())
        .maxInFlight(1)
        .cacheTtl(config.cacheTtl())
        .build();
  }

  /** {@inheritDoc} */
  @Override
  public Optional<CatalogArtist> searchArtist(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    final JsonNode node = client.fetch("/artist", params(
        "query", "artist:" + name, "limit", "10"));

    JsonNode best = null;
    for (final JsonNode artist : node.path("artists")) {
      if (best == null) {
        best = artist;
      }
      if (name.equalsIgnoreCase(artist.path("name").asText())) {
        best = artist;
        break;
      }
    }
    return Optional.ofNullable(best).map(MusicBrainzCatalog::toArtist);
  }

  /** {@inheritDoc} */
  @Override
  public Discography discography(final String artistId) {
    Objects.requireNonNull(artistId, "artistId must not be null");
    final JsonNode artist = client.fetch("/artist/" + artistId,
        params("inc", "release-groups"));

    JsonNode groups = artist.path("release-groups");
    if (groups.isEmpty()) {
      log.debug("Artist {} came without release groups, browsing them",
          artistId);
      groups = client.fetch("/release-group", params("artist", artistId,
          "limit", "100")).path("release-groups");
    }

    final List<ReleaseGroup> releaseGroups = new ArrayList<>();
    for (final JsonNode group : groups) {
      releaseGroups.add(toReleaseGroup(group));
    }
    return new Discography(toArtist(artist), releaseGroups);
  }

  /**
   * {@inheritDoc}
   *
   * <p>A release without media information counts as digital, and so does
   * any medium whose format is known and not a vinyl one.
   */
  @Override
  public boolean hasDigitalRelease(final String releaseGroupId) {
    Objects.requireNonNull(releaseGroupId, "releaseGroupId must not be null");
    final JsonNode node = client.fetch("/release", params(
        "release-group", releaseGroupId, "limit", "50"));

    for (final JsonNode release : node.path("releases")) {
      final JsonNode media = release.path("media");
      if (media.isEmpty()) {
        return true;
      }
      for (final JsonNode medium : media) {
        if (isDigital(medium.path("format").asText(""))) {
          return true;
        }
      }
    }
    log.debug("Release group {} is vinyl only", releaseGroupId);
    return false;
  }

  /** {@inheritDoc} */
  @Override
  public Optional<CatalogRelease> tracklist(final String releaseGroupId) {
    Objects.requireNonNull(releaseGroupId, "releaseGroupId must not be null");

    final Map<String, String> params = params("release-group",
        releaseGroupId, "limit", "5", "inc", "media+recordings");
    final Map<String, String> official = new LinkedHashMap<>(params);
    official.put("status", "official");

    JsonNode releases = client.fetch("/release", official).path("releases");
    if (releases.isEmpty()) {
      log.debug("No official release for {}, trying every status",
          releaseGroupId);
      releases = client.fetch("/release", params).path("releases");
    }
    if (releases.isEmpty()) {
      return Optional.empty();
    }

    JsonNode chosen = releases.get(0);
    for (final JsonNode release : releases) {
      if (!release.path("media").isEmpty()) {
        chosen = release;
        break;
      }
    }

    final List<CatalogTrack> tracks = new ArrayList<>();
    for (final JsonNode disc : chosen.path("media")) {
      final int discNumber = disc.path("position").asInt(1);
      for (final JsonNode track : disc.path("tracks")) {
        tracks.add(toTrack(track, discNumber));
      }
    }
    return Optional.of(new CatalogRelease(releaseGroupId,
        chosen.path("id").asText(), text(chosen, "title"), tracks));
  }

  /** {@inheritDoc} */
  @Override
  public Optional<ReleaseGroup> searchReleaseGroup(final String artistName,
      final String albumTitle) {
    Objects.requireNonNull(artistName, "artistName must not be null");
    Objects.requireNonNull(albumTitle, "albumTitle must not be null");
    final String query = "release:\"" + unquote(albumTitle)
        + "\" AND artist:\"" + unquote(artistName) + "\"";
    final JsonNode node = client.fetch("/release-group", params(
        "query", query, "limit", "5"));

    final JsonNode groups = node.path("release-groups");
    if (groups.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(toReleaseGroup(groups.get(0)));
  }

  /** {@inheritDoc} */
  @Override
  public Optional<CoverArt> coverArt(final String releaseGroupId) {
    Objects.requireNonNull(releaseGroupId, "releaseGroupId must not be null");
    final String front = config.coverArtUrl() + "/release-group/"
        + releaseGroupId + "/front";
    final int status = client.head(front, config.coverArtTimeout());
    if (!COVER_FOUND.contains(status)) {
      log.debug("No cover art for {} ({})", releaseGroupId, status);
      return Optional.empty();
    }
    return Optional.of(new CoverArt(front + "-500", front + "-1200"));
  }

  // -----------------------------------------------------------------------
  // Internals
  // -----------------------------------------------------------------------

  /**
   * Tells whether a medium format is digital or CD-like.
   *
   * @param format the format, empty when unknown
   * @return true for digital or unknown non-vinyl formats
   */
  static boolean isDigital(final String format) {
    final String lower = format.toLowerCase(Locale.ROOT);
    if (DIGITAL_FORMATS.stream().anyMatch(lower::contains)) {
      return true;
    }
    return !lower.isEmpty()
        && VINYL_FORMATS.stream().noneMatch(lower::contains);
  }

  /** Builds an ordered parameter map from name/value pairs. */
  private static Map<String, String> params(final String... pairs) {
    final Map<String, String> params = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      params.put(pairs[i], pairs[i + 1]);
    }
    return params;
  }

  /** Drops the double quotes that would break a phrase query. */
  private static String unquote(final String value) {
    return value.replace("\"", "");
  }

  private static CatalogArtist toArtist(final JsonNode node) {
    final JsonNode lifeSpan = node.path("life-span");
    return new CatalogArtist(node.path("id").asText(), text(node, "name"),
        text(node, "country"), text(node, "type"), text(lifeSpan, "begin"),
        text(lifeSpan, "end"));
  }

  private static ReleaseGroup toReleaseGroup(final JsonNode node) {
    final List<String> secondary = new ArrayList<>();
    for (final JsonNode type : node.path("secondary-types")) {
      secondary.add(type.asText());
    }
    final String firstRelease = text(node, "first-release-date");
    return new ReleaseGroup(node.path("id").asText(), text(node, "title"),
        text(node, "primary-type"), secondary, year(firstRelease),
        date(firstRelease));
  }

  private static CatalogTrack toTrack(final JsonNode node,
      final int discNumber) {
    final JsonNode recording = node.path("recording");
    final String id = recording.hasNonNull("id")
        ? recording.get("id").asText()
        : node.path("id").asText();
    final String title = node.hasNonNull("title")
        ? node.get("title").asText()
        : text(recording, "title");

    int position = node.path("position").asInt(0);
    if (position == 0) {
      position = node.path("number").asInt(0);
    }

    Long length = null;
    if (node.hasNonNull("length")) {
      length = node.get("length").asLong();
    } else if (recording.hasNonNull("length")) {
      length = recording.get("length").asLong();
    }
    return new CatalogTrack(id, title, position, discNumber, length);
  }

  /**
   * Reads a textual field.
   *
   * @param node  the object, never null
   * @param field the field name, never null
   * @return the text, or null if missing, null or empty
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
   * Reads a MusicBrainz date down to the day. A {@code 1982-11} date stands
   * for the first day of the month; a year alone gives no date.
   *
   * @param date the date, may be null
   * @return the date, or null if no month is known
   */
  private static LocalDate date(final String date) {
    if (date == null || date.length() < 7) {
      return null;
    }
    try {
      if (date.length() == 7) {
        return YearMonth.parse(date).atDay(1);
      }
      return LocalDate.parse(date);
    } catch (final DateTimeParseException e) {
      log.debug("Ignoring malformed release date '{}'", date);
      return null;
    }
  }

  /**
   * Extracts the year of a partial MusicBrainz date such as {@code 1982},
   * {@code 1982-11} or {@code 1982-11-30}.
   *
   * @param date the date, may be null
   * @return the year, or null if unknown
   */
  private static Integer year(final String date) {
    if (date == null || date.length() < 4) {
      return null;
    }
    try {
      return Integer.valueOf(date.substring(0, 4));
    } catch (final NumberFormatException e) {
      log.debug("Ignoring malformed release date '{}'", date);
      return null;
    }
  }
}
