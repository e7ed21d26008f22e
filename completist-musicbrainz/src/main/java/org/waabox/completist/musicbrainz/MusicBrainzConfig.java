package org.waabox.completist.musicbrainz;

import java.time.Duration;
import java.util.Objects;

import org.waabox.completist.RetryPolicy;

/**
 * Immutable configuration holder for the MusicBrainz catalog.
 *
 * <p>MusicBrainz rejects anonymous clients, so the {@code userAgent} is
 * required and should name the application, its version and a contact,
 * such as {@code Completist/1.0 (ops@example.org)}.
 *
 * <p>Instances are created via the {@link Builder} returned by
 * {@link #builder(String)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MusicBrainzConfig {

  /** The public MusicBrainz web service. */
  private static final String DEFAULT_BASE_URL = "https://musicbrainz.org/ws/2";

  /** The public Cover Art Archive. */
  private static final String DEFAULT_COVER_ART_URL =
      "https://coverartarchive.org";

  /** Default request timeout. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /** Default cover art probe timeout. */
  private static final Duration DEFAULT_COVER_ART_TIMEOUT =
      Duration.ofSeconds(5);

  /** Default response cache time to live. */
  private static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(24);

  /** The User-Agent header value, never null. */
  private final String userAgent;

  /** The web service base URL, never null. */
  private final String baseUrl;

  /** The Cover Art Archive base URL, without trailing slash, never null. */
  private final String coverArtUrl;

  /** The request timeout, never null. */
  private final Duration timeout;

  /** The cover art probe timeout, never null. */
  private final Duration coverArtTimeout;

  /** The response cache time to live, never null. */
  private final Duration cacheTtl;

  /** The retry policy, never null. */
  private final RetryPolicy retryPolicy;

  /** Creates a config from the builder.
   *
   * @param builder the builder to construct from, never null
   */
  private MusicBrainzConfig(final Builder builder) {
    userAgent = builder.userAgent;
    baseUrl = builder.baseUrl;
    coverArtUrl = builder.coverArtUrl.endsWith("/")
        ? builder.coverArtUrl.substring(0, builder.coverArtUrl.length() - 1)
        : builder.coverArtUrl;
    timeout = builder.timeout;
    coverArtTimeout = builder.coverArtTimeout;
    cacheTtl = builder.cacheTtl;
    retryPolicy = builder.retryPolicy;
  }

  /**
   * Returns the User-Agent sent with every request.
   *
   * @return the user agent, never null
   */
  public String userAgent() {
    return userAgent;
  }

  /**
   * Returns the web service base URL.
   *
   * @return the base URL, never null
   */
  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Returns the Cover Art Archive base URL.
   *
   * @return the URL, without trailing slash, never null
   */
  public String coverArtUrl() {
    return coverArtUrl;
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
   * Returns the timeout of the cover art existence probe.
   *
   * @return the timeout, never null
   */
  public Duration coverArtTimeout() {
    return coverArtTimeout;
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
   * Returns the retry policy.
   *
   * <p>Defaults to three retries starting at five seconds.
   *
   * @return the policy, never null
   */
  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /**
   * Creates a new builder.
   *
   * @param userAgent the User-Agent header value, never null or blank
   * @return a new builder instance, never null
   */
  public static Builder builder(final String userAgent) {
    return new Builder(userAgent);
  }

  /**
   * A builder for constructing {@link MusicBrainzConfig} instances.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    /** The User-Agent header value. */
    private final String userAgent;

    /** The web service base URL. */
    private String baseUrl = DEFAULT_BASE_URL;

    /** The Cover Art Archive base URL. */
    private String coverArtUrl = DEFAULT_COVER_ART_URL;

    /** The request timeout. */
    private Duration timeout = DEFAULT_TIMEOUT;

    /** The cover art probe timeout. */
    private Duration coverArtTimeout = DEFAULT_COVER_ART_TIMEOUT;

    /** The cache ttl. */
    private Duration cacheTtl = DEFAULT_CACHE_TTL;

    /** The retry policy. */
    private RetryPolicy retryPolicy = RetryPolicy.of(3,
        Duration.ofSeconds(5));

    /**
     * Creates a new Builder instance.
     *
     * @param theUserAgent the User-Agent header value, never null or blank
     */
    private Builder(final String theUserAgent) {
      Objects.requireNonNull(theUserAgent, "userAgent must not be null");
      if (theUserAgent.isBlank()) {
        throw new IllegalArgumentException("userAgent must not be blank");
      }
      userAgent = theUserAgent;
    }

    /**
     * Sets the web service base URL.
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
     * Sets the Cover Art Archive base URL.
     *
     * @param theCoverArtUrl the URL, never null
     * @return this builder for chaining, never null
     */
    public Builder coverArtUrl(final String theCoverArtUrl) {
      coverArtUrl = Objects.requireNonNull(theCoverArtUrl,
          "coverArtUrl must not be null");
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
     * Sets the cover art probe timeout.
     *
     * @param theTimeout the timeout, never null
     * @return this builder for chaining, never null
     */
    public Builder coverArtTimeout(final Duration theTimeout) {
      coverArtTimeout = Objects.requireNonNull(theTimeout,
          "coverArtTimeout must not be null");
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
     * Sets the retry policy.
     *
     * @param theRetryPolicy the policy, never null
     * @return this builder for chaining, never null
     */
    public Builder retryPolicy(final RetryPolicy theRetryPolicy) {
      retryPolicy = Objects.requireNonNull(theRetryPolicy,
          "retryPolicy must not be null");
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new instance, never null
     */
    public MusicBrainzConfig build() {
      return new MusicBrainzConfig(this);
    }
  }
}
