package org.waabox.completist.tmdb;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration holder for the TMDB catalog.
 *
 * <p>Holds the optional API key, the API and image base URLs, the request
 * timeout, the maximum number of in-flight requests and the response cache
 * time to live. When no API key is configured, {@link TmdbCatalog} reads it
 * from the {@code tmdb_api_key} store setting.
 *
 * <p>Instances are created via the {@link Builder} returned by
 * {@link #builder()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TmdbConfig {

  /** The public TMDB API endpoint. */
  private static final String DEFAULT_BASE_URL = "https://api.themoviedb.org/3";

  /** The public TMDB image endpoint. */
  private static final String DEFAULT_IMAGE_BASE_URL =
      "https://image.tmdb.org/t/p/";

  /** Default request timeout. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /** Default cap of concurrent requests. */
  private static final int DEFAULT_MAX_IN_FLIGHT = 10;

  /** Default response cache time to live. */
  private static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(24);

  /** The API key, may be null. */
  private final String apiKey;

  /** The API base URL, never null. */
  private final String baseUrl;

  /** The image base URL, ending with a slash, never null. */
  private final String imageBaseUrl;

  /** The request timeout, never null. */
  private final Duration timeout;

  /** The maximum number of in-flight requests. */
  private final int maxInFlight;

  /** The response cache time to live, never null. */
  private final Duration cacheTtl;

  /** Creates a config from the builder.
   *
   * @param builder the builder to construct from, never null
   */
  private TmdbConfig(final Builder builder) {
    apiKey = builder.apiKey;
    baseUrl = builder.baseUrl;
    imageBaseUrl = builder.imageBaseUrl.endsWith("/")
        ? builder.imageBaseUrl
        : builder.imageBaseUrl + "/";
    timeout = builder.timeout;
    maxInFlight = builder.maxInFlight;
    cacheTtl = builder.cacheTtl;
  }

  /**
   * Returns the configured API key.
   *
   * @return the key, or empty to fall back to the store setting
   */
  public Optional<String> apiKey() {
    return Optional.ofNullable(apiKey);
  }

  /**
   * Returns the API base URL.
   *
   * <p>Defaults to {@code https://api.themoviedb.org/3}.
   *
   * @return the base URL, never null
   */
  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Returns the image base URL.
   *
   * @return the image base URL, ending with a slash, never null
   */
  public String imageBaseUrl() {
    return imageBaseUrl;
  }

  /**
   * Returns the request timeout.
   *
   * @return the timeout, never null
   */
  public Duration timeout() {
    return timeout;
  }

  /**
   * Returns the maximum number of in-flight requests.
   *
   * @return the cap, greater than zero
   */
  public int maxInFlight() {
    return maxInFlight;
  }

  /**
   * Returns the response cache time to live.
   *
   * @return the ttl, never null
   */
  public Duration cacheTtl() {
    return cacheTtl;
  }

  /**
   * Creates a new builder for constructing a {@link TmdbConfig}.
   *
   * @return a new builder instance, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a configuration with every default and no API key.
   *
   * @return the default configuration, never null
   */
  public static TmdbConfig defaults() {
    return builder().build();
  }

  /**
   * A builder for constructing {@link TmdbConfig} instances.
   *
   * <p>Every field is optional.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    /** The API key. */
    private String apiKey;

    /** The API base URL. */
    private String baseUrl = DEFAULT_BASE_URL;

    /** The image base URL. */
    private String imageBaseUrl = DEFAULT_IMAGE_BASE_URL;

    /** The request timeout. */
    private Duration timeout = DEFAULT_TIMEOUT;

    /** The in-flight cap. */
    private int maxInFlight = DEFAULT_MAX_IN_FLIGHT;

    /** The cache ttl. */
    private Duration cacheTtl = DEFAULT_CACHE_TTL;

    /** Creates a new Builder instance. */
    private Builder() {
    }

    /**
     * Sets the API key. Blank keys are ignored.
     *
     * @param theApiKey the API key, may be null
     * @return this builder for chaining, never null
     */
    public Builder apiKey(final String theApiKey) {
      apiKey = theApiKey == null || theApiKey.isBlank()
          ? null : theApiKey.trim();
      return this;
    }

    /**
     * Sets the API base URL.
     *
     * @param theBaseUrl the base URL, never null
     * @return this builder for chaining, never null
     */
    public Builder baseUrl(final String theBaseUrl) {
      baseUrl = Objects.requireNonNull(theBaseUrl,
          "baseUrl must not be null");
      return this;
    }

    /**
     * Sets the image base URL.
     *
     * @param theImageBaseUrl the image base URL, never null
     * @return this builder for chaining, never null
     */
    public Builder imageBaseUrl(final String theImageBaseUrl) {
      imageBaseUrl = Objects.requireNonNull(theImageBaseUrl,
          "imageBaseUrl must not be null");
      return this;
    }

    /**
     * Sets the request timeout.
     *
     * @param theTimeout the timeout, never null
     * @return this builder for chaining, never null
     */
    public Builder timeout(final Duration theTimeout) {
      timeout = Objects.requireNonNull(theTimeout,
          "timeout must not be null");
      return this;
    }

    /**
     * Sets the maximum number of in-flight requests.
     *
     * @param theMaxInFlight the cap, greater than zero
     * @return this builder for chaining, never null
     */
    public Builder maxInFlight(final int theMaxInFlight) {
      if (theMaxInFlight <= 0) {
        throw new IllegalArgumentException(
            "maxInFlight must be positive, got: " + theMaxInFlight);
      }
      maxInFlight = theMaxInFlight;
      return this;
    }

    /**
     * Sets the response cache time to live.
     *
     * @param theCacheTtl the ttl, never null
     * @return this builder for chaining, never null
     */
    public Builder cacheTtl(final Duration theCacheTtl) {
      cacheTtl = Objects.requireNonNull(theCacheTtl,
          "cacheTtl must not be null");
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new instance, never null
     */
    public TmdbConfig build() {
      return new TmdbConfig(this);
    }
  }
}
