package org.waabox.completist.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.cache.ResponseCache;
import org.waabox.completist.metrics.CompletistMetrics;
import org.waabox.completist.ratelimit.RateLimiter;

/**
 * Read-only JSON client for an external catalog API.
 *
 * <p>Every {@link #fetch(String, Map) fetch} goes through, in order:
 * <ol>
 *   <li>the {@link ResponseCache}: a hit bypasses the network and the
 *       rate limiter;</li>
 *   <li>a fair semaphore capping the in-flight requests, so excess callers
 *       queue in arrival order;</li>
 *   <li>the {@link RateLimiter};</li>
 *   <li>a {@code java.net.http} request bounded by the configured
 *       timeout.</li>
 * </ol>
 *
 * <p>Failures are reported as {@link CatalogHttpException} (non-2xx),
 * {@link CatalogTimeoutException} (timeout) or {@link CatalogIoException}
 * (connection failures). One client instance is meant to serve every caller
 * of a catalog.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class CatalogHttpClient {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CatalogHttpClient.class);

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The lowest successful HTTP status. */
  private static final int HTTP_OK = 200;

  /** The lowest HTTP status that is not successful. */
  private static final int HTTP_MULTIPLE_CHOICES = 300;

  /** The client configuration. */
  private final CatalogHttpConfig config;

  /** The rate limiter awaited before each uncached request. */
  private final RateLimiter rateLimiter;

  /** The response cache. */
  private final ResponseCache<JsonNode> cache;

  /** Caps the in-flight requests. */
  private final Semaphore inFlight;

  /** The metrics reporter. */
  private final CompletistMetrics metrics;

  /** The underlying HTTP client. */
  private final HttpClient httpClient;

  /**
   * Creates a new catalog client backed by a new {@link HttpClient}.
   *
   * @param theConfig      the configuration, never null
   * @param theRateLimiter the rate limiter, never null
   * @param clock          the clock used by the response cache, never null
   * @param theMetrics     the metrics reporter, never null
   */
  public CatalogHttpClient(final CatalogHttpConfig theConfig,
      final RateLimiter theRateLimiter, final Clock clock,
      final CompletistMetrics theMetrics) {
    this(theConfig, theRateLimiter, clock, theMetrics,
        HttpClient.newBuilder()
            .connectTimeout(theConfig.timeout())
            .build());
  }

  /**
   * Creates a new catalog client.
   *
   * @param theConfig      the configuration, never null
   * @param theRateLimiter the rate limiter, never null
   * @param clock          the clock used by the response cache, never null
   * @param theMetrics     the metrics reporter, never null
   * @param theHttpClient  the HTTP client, never null
   */
  public CatalogHttpClient(final CatalogHttpConfig theConfig,
      final RateLimiter theRateLimiter, final Clock clock,
      final CompletistMetrics theMetrics, final HttpClient theHttpClient) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    rateLimiter = Objects.requireNonNull(theRateLimiter,
        "rateLimiter must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    httpClient = Objects.requireNonNull(theHttpClient,
        "httpClient must not be null");
    Objects.requireNonNull(clock, "clock must not be null");
    cache = new ResponseCache<>(config.cacheTtl(), clock);
    inFlight = new Semaphore(config.maxInFlight(), true);
  }

  /**
   * Fetches an endpoint without parameters.
   *
   * @param endpoint the endpoint path, starting with a slash, never null
   * @return the parsed JSON body, never null
   *
   * @throws CatalogException if the request fails
   */
  public JsonNode fetch(final String endpoint) {
    return fetch(endpoint, Map.of(), Map.of());
  }

  /**
   * Fetches an endpoint.
   *
   * @param endpoint the endpoint path, starting with a slash, never null
   * @param params   the query parameters, never null
   * @return the parsed JSON body, never null
   *
   * @throws CatalogException if the request fails
   */
  public JsonNode fetch(final String endpoint,
      final Map<String, String> params) {
    return fetch(endpoint, params, Map.of());
  }

  /**
   * Fetches an endpoint sending credentials as extra query parameters.
   *
   * <p>Credentials are appended to the URL only: they are neither part of
   * the cache key nor logged.
   *
   * @param endpoint    the endpoint path, starting with a slash, never null
   * @param params      the query parameters, never null
   * @param credentials the credential parameters, never null
   * @return the parsed JSON body, never null
   *
   * @throws CatalogException if the request fails
   */
  public JsonNode fetch(final String endpoint,
      final Map<String, String> params,
      final Map<String, String> credentials) {
    Objects.requireNonNull(endpoint, "endpoint must not be null");
    Objects.requireNonNull(params, "params must not be null");
    Objects.requireNonNull(credentials, "credentials must not be null");

    final String key = ResponseCache.key(endpoint, params);
    final Optional<JsonNode> cached = cache.get(key);
    if (cached.isPresent()) {
      log.debug("{}: cache hit for {}", config.name(), key);
      metrics.cacheHit(config.name());
      return cached.get();
    }

    final JsonNode body = execute(endpoint, params, credentials);
    cache.put(key, body);
    return body;
  }

  /**
   * Checks a URL with a HEAD request, outside the cache and the rate
   * limiter.
   *
   * @param url     the absolute URL, never null
   * @param timeout the request timeout, never null
   * @return the HTTP status of the response
   *
   * @throws CatalogTimeoutException if the request times out
   * @throws CatalogIoException      if the host cannot be reached
   */
  public int head(final String url, final Duration timeout) {
    Objects.requireNonNull(url, "url must not be null");
    Objects.requireNonNull(timeout, "timeout must not be null");

    final HttpRequest.Builder request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(timeout)
        .method("HEAD", HttpRequest.BodyPublishers.noBody());
    config.headers().forEach(request::header);

    return send(request.build(), url).statusCode();
  }

  /** Drops every cached response. */
  public void clearCache() {
    cache.clear();
  }

  /**
   * Returns the response cache statistics.
   *
   * @return the statistics, never null
   */
  public ResponseCache.Stats cacheStats() {
    return cache.stats();
  }

  /**
   * Returns the client configuration.
   *
   * @return the configuration, never null
   */
  public CatalogHttpConfig config() {
    return config;
  }

  /**
   * Performs one uncached request: waits for an in-flight slot, then for
   * the rate limiter, then sends the request.
   *
   * @param endpoint    the endpoint path, never null
   * @param params      the query parameters, never null
   * @param credentials the credential parameters, never null
   * @return the parsed JSON body, never null
   *
   * @throws CatalogException if the request fails
   */
  protected JsonNode execute(final String endpoint,
      final Map<String, String> params,
      final Map<String, String> credentials) {
    final String description = ResponseCache.key(endpoint, params);
    try {
      inFlight.acquire();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CatalogIoException(config.name()
          + ": interrupted while queued for " + description, e);
    }
    try {
      rateLimiter.acquire();
      log.debug("{}: GET {}", config.name(), description);

      final HttpRequest.Builder request = HttpRequest.newBuilder()
          .uri(buildUri(endpoint, params, credentials))
          .timeout(config.timeout())
          .header("Accept", "application/json")
          .GET();
      config.headers().forEach(request::header);

      final HttpResponse<String> response = send(request.build(),
          description);
      return parse(response, description);

    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CatalogIoException(config.name()
          + ": interrupted while waiting for the rate limiter", e);
    } finally {
      inFlight.release();
    }
  }

  /**
   * Sends a request, translating transport failures.
   *
   * @param request     the request, never null
   * @param description the request description for errors, never null
   * @return the response, never null
   */
  private HttpResponse<String> send(final HttpRequest request,
      final String description) {
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (final HttpTimeoutException e) {
      throw new CatalogTimeoutException(config.name() + ": request to "
          + description + " timed out after " + config.timeout(), e);
    } catch (final IOException e) {
      throw new CatalogIoException(config.name() + ": request to "
          + description + " failed: " + e.getMessage(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CatalogIoException(config.name() + ": request to "
          + description + " was interrupted", e);
    }
  }

  /**
   * Checks the status and parses the body of a response.
   *
   * @param response    the response, never null
   * @param description the request description for errors, never null
   * @return the parsed body, never null
   */
  private JsonNode parse(final HttpResponse<String> response,
      final String description) {
    final int status = response.statusCode();
    if (status < HTTP_OK || status >= HTTP_MULTIPLE_CHOICES) {
      log.debug("{}: {} answered {}", config.name(), description, status);
      throw new CatalogHttpException(status, remoteMessage(response.body()),
          retryAfter(response));
    }
    try {
      return MAPPER.readTree(response.body());
    } catch (final JsonProcessingException e) {
      throw new CatalogException(config.name()
          + ": malformed response from " + description, e);
    }
  }

  /**
   * Extracts the error message a catalog embeds in a JSON error body.
   *
   * @param body the response body, may be null
   * @return the message, or null if there is none
   */
  private static String remoteMessage(final String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      final JsonNode node = MAPPER.readTree(body);
      for (final String field : new String[] {
          "status_message", "error", "message"}) {
        final JsonNode value = node.get(field);
        if (value != null && value.isTextual()) {
          return value.asText();
        }
      }
      return null;
    } catch (final JsonProcessingException e) {
      return body.length() > 200 ? body.substring(0, 200) : body;
    }
  }

  /**
   * Reads the Retry-After header, expressed in seconds.
   *
   * @param response the response, never null
   * @return the delay, or null if the header is absent or not a number
   */
  private static Duration retryAfter(final HttpResponse<String> response) {
    final Optional<String> header =
        response.headers().firstValue("Retry-After");
    if (header.isEmpty()) {
      return null;
    }
    try {
      return Duration.ofSeconds(Long.parseLong(header.get().trim()));
    } catch (final NumberFormatException e) {
      log.debug("Ignoring non numeric Retry-After: {}", header.get());
      return null;
    }
  }

  /**
   * Builds the request URI.
   *
   * @param endpoint    the endpoint path, never null
   * @param params      the query parameters, never null
   * @param credentials the credential parameters, never null
   * @return the URI, never null
   */
  private URI buildUri(final String endpoint,
      final Map<String, String> params,
      final Map<String, String> credentials) {
    final Map<String, String> query = new LinkedHashMap<>(params);
    query.putAll(config.defaultParams());
    query.putAll(credentials);

    final StringBuilder uri = new StringBuilder(config.baseUrl())
        .append(endpoint);
    char separator = endpoint.indexOf('?') < 0 ? '?' : '&';
    for (final Map.Entry<String, String> entry : query.entrySet()) {
      uri.append(separator)
          .append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
          .append('=')
          .append(URLEncoder.encode(entry.getValue(),
              StandardCharsets.UTF_8));
      separator = '&';
    }
    return URI.create(uri.toString());
  }
}
