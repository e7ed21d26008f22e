package org.waabox.completist.http;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.waabox.completist.cache.ResponseCache;

/**
 * Configuration holder for a {@link CatalogHttpClient}.
 *
 * <p>Holds the catalog name (used in logs and metrics), the base URL, the
 * headers and query parameters sent with every request, the per-request
 * timeout, the maximum number of in-flight requests and the response cache
 * time to live.
 *
 * <p>Instances are created through {@link #builder(String, String)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogHttpConfig {

  /** The default per-request timeout. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /** The default maximum number of in-flight requests. */
  private static final int DEFAULT_MAX_IN_FLIGHT = 10;

  /** The catalog name. */
  private final String name;

  /** The base URL, without a trailing slash. */
  private final String baseUrl;

  /** The headers sent with every request. */
  private final Map<String, String> headers;

  /** The query parameters sent with every request. */
  private final Map<String, String> defaultParams;

  /** The per-request timeout. */
  private final Duration timeout;

  /** The maximum number of in-flight requests. */
  private final int maxInFlight;

  /** The response cache time to live. */
  private final Duration cacheTtl;

  /** Private constructor; use the builder instead. */
  private CatalogHttpConfig(final Builder builder) {
    name = builder.name;
    baseUrl = builder.baseUrl;
    headers = Map.copyOf(builder.headers);
    defaultParams = Map.copyOf(builder.defaultParams);
    timeout = builder.timeout;
    maxInFlight = builder.maxInFlight;
    cacheTtl = builder.cacheTtl;
  }

  /**
   * Creates a new builder.
   *
   * @param name    the catalog name, never null
   * @param baseUrl the base URL of the catalog API, never null
   * @return a new builder, never null
   */
  public static Builder builder(final String name, final String baseUrl) {
    return new Builder(name, baseUrl);
  }

  /**
   * Returns the catalog name.
   *
   * @return the name, never null
   */
  public String name() {
    return name;
  }

  /**
   * Returns the base URL, without a trailing slash.
   *
   * @return the base URL, never null
   */
  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Returns the headers sent with every request.
   *
   * @return an unmodifiable map, never null
   */
  public Map<String, String> headers() {
    return headers;
  }

  /**
   * Returns the query parameters sent with every request.
   *
   * @return an unmodifiable map, never null
   */
  public Map<String, String> defaultParams() {
    return defaultParams;
  }

  /**
   * Returns the per-request timeout.
   *
   * @return the timeout, never null
   */
  public Duration timeout() {
    return timeout;
  }

  /**
   * Returns the maximum number of in-flight requests.
   *
   * @return the limit, always greater than zero
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
   * A fluent builder for {@link CatalogHttpConfig}.
   *
   * <p>Defaults: 30 seconds timeout, 10 in-flight requests, 24 hours
   * cache time to live, no extra headers or parameters.
   */
  public static final class Builder {

    /** The catalog name. */
    private final String name;

    /** The base URL. */
    private final String baseUrl;

    /** The headers sent with every request. */
    private final Map<String, String> headers = new LinkedHashMap<>();

    /** The query parameters sent with every request. */
    private final Map<String, String> defaultParams = new LinkedHashMap<>();

    /** The per-request timeout. */
    private Duration timeout = DEFAULT_TIMEOUT;

    /** The maximum number of in-flight requests. */
    private int maxInFlight = DEFAULT_MAX_IN_FLIGHT;

    /** The response cache time to live. */
    private Duration cacheTtl = ResponseCache.DEFAULT_TTL;

    /**
     * Creates a new builder.
     *
     * @param theName    the catalog name, never null
     * @param theBaseUrl the base URL, never null
     */
    private Builder(final String theName, final String theBaseUrl) {
      name = Objects.requireNonNull(theName, "name must not be null");
      Objects.requireNonNull(theBaseUrl, "baseUrl must not be null");
      baseUrl = theBaseUrl.endsWith("/")
          ? theBaseUrl.substring(0, theBaseUrl.length() - 1)
          : theBaseUrl;
    }

    /**
     * Adds a header sent with every request.
     *
     * @param theName  the header name, never null
     * @param theValue the header value, never null
     * @return this builder for chaining, never null
     */
    public Builder header(final String theName, final String theValue) {
      Objects.requireNonNull(theName, "header name must not be null");
      Objects.requireNonNull(theValue, "header value must not be null");
      headers.put(theName, theValue);
      return this;
    }

    /**
     * Adds a query parameter sent with every request.
     *
     * <p>Default parameters are part of the URL but not of the cache key.
     *
     * @param theName  the parameter name, never null
     * @param theValue the parameter value, never null
     * @return this builder for chaining, never null
     */
    public Builder defaultParam(final String theName, final String theValue) {
      Objects.requireNonNull(theName, "param name must not be null");
      Objects.requireNonNull(theValue, "param value must not be null");
      defaultParams.put(theName, theValue);
      return this;
    }

    /**
     * Sets the per-request timeout.
     *
     * @param theTimeout the timeout, never null
     * @return this builder for chaining, never null
     */
    public Builder timeout(final Duration theTimeout) {
      timeout = Objects.requireNonNull(theTimeout, "timeout must not be null");
      return this;
    }

    /**
     * Sets the maximum number of in-flight requests.
     *
     * @param theMaxInFlight the limit, greater than zero
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theMaxInFlight is not positive
     */
    public Builder maxInFlight(final int theMaxInFlight) {
      if (theMaxInFlight <= 0) {
        throw new IllegalArgumentException(
            "maxInFlight must be greater than 0, got: " + theMaxInFlight);
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
     * @return a new configuration, never null
     */
    public CatalogHttpConfig build() {
      return new CatalogHttpConfig(this);
    }
  }
}
