package org.waabox.completist.http;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.RetryPolicy;
import org.waabox.completist.metrics.CompletistMetrics;
import org.waabox.completist.ratelimit.RateLimiter;
import org.waabox.completist.ratelimit.Sleeper;

/**
 * A {@link CatalogHttpClient} for catalogs with strict rate caps, retrying
 * transient failures with exponential backoff.
 *
 * <p>Timeouts, connection failures and the HTTP statuses listed by the
 * {@link RetryPolicy} are retried; the rate limiter is awaited again before
 * every attempt. Any other failure is wrapped in a
 * {@link NonRetryableCatalogException} and fails immediately. Once the
 * retries are exhausted the last failure is rethrown.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RetryingCatalogHttpClient extends CatalogHttpClient {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      RetryingCatalogHttpClient.class);

  /** The retry policy. */
  private final RetryPolicy retryPolicy;

  /** The sleeper used between attempts. */
  private final Sleeper sleeper;

  /** The metrics reporter. */
  private final CompletistMetrics metrics;

  /**
   * Creates a new retrying client backed by a new {@link HttpClient}.
   *
   * @param config         the configuration, never null
   * @param rateLimiter    the rate limiter, never null
   * @param clock          the clock used by the response cache, never null
   * @param theMetrics     the metrics reporter, never null
   * @param theRetryPolicy the retry policy, never null
   * @param theSleeper     the sleeper used between attempts, never null
   */
  public RetryingCatalogHttpClient(final CatalogHttpConfig config,
      final RateLimiter rateLimiter, final Clock clock,
      final CompletistMetrics theMetrics, final RetryPolicy theRetryPolicy,
      final Sleeper theSleeper) {
    super(config, rateLimiter, clock, theMetrics);
    metrics = theMetrics;
    retryPolicy = Objects.requireNonNull(theRetryPolicy,
        "retryPolicy must not be null");
    sleeper = Objects.requireNonNull(theSleeper, "sleeper must not be null");
  }

  /**
   * Creates a new retrying client.
   *
   * @param config         the configuration, never null
   * @param rateLimiter    the rate limiter, never null
   * @param clock          the clock used by the response cache, never null
   * @param theMetrics     the metrics reporter, never null
   * @param theRetryPolicy the retry policy, never null
   * @param theSleeper     the sleeper used between attempts, never null
   * @param httpClient     the HTTP client, never null
   */
  public RetryingCatalogHttpClient(final CatalogHttpConfig config,
      final RateLimiter rateLimiter, final Clock clock,
      final CompletistMetrics theMetrics, final RetryPolicy theRetryPolicy,
      final Sleeper theSleeper, final HttpClient httpClient) {
    super(config, rateLimiter, clock, theMetrics, httpClient);
    metrics = theMetrics;
    retryPolicy = Objects.requireNonNull(theRetryPolicy,
        "retryPolicy must not be null");
    sleeper = Objects.requireNonNull(theSleeper, "sleeper must not be null");
  }

  /** {@inheritDoc} */
  @Override
  protected JsonNode execute(final String endpoint,
      final Map<String, String> params,
      final Map<String, String> credentials) {
    final String catalog = config().name();
    final int maxRetries = retryPolicy.maxRetries();

    for (int attempt = 0; ; attempt++) {
      try {
        return super.execute(endpoint, params, credentials);
      } catch (final CatalogException e) {
        if (!isRetryable(e)) {
          if (e instanceof NonRetryableCatalogException) {
            throw e;
          }
          throw new NonRetryableCatalogException(e.getMessage(), e);
        }
        if (attempt >= maxRetries) {
          log.error("{}: request to {} failed after {} retries: {}",
              catalog, endpoint, maxRetries, e.getMessage());
          throw e;
        }
        final Duration delay = delayFor(attempt, e);
        log.warn("{}: request to {} failed, retry {}/{} in {} ms: {}",
            catalog, endpoint, attempt + 1, maxRetries, delay.toMillis(),
            e.getMessage());
        metrics.requestRetried(catalog, attempt + 1, e);
        sleepOrAbort(delay, e);
      }
    }
  }

  /**
   * Decides whether a failure is transient.
   *
   * @param e the failure, never null
   * @return true if the request should be retried
   */
  private boolean isRetryable(final CatalogException e) {
    if (e instanceof CatalogTimeoutException) {
      return true;
    }
    if (e instanceof CatalogIoException) {
      return !Thread.currentThread().isInterrupted();
    }
    if (e instanceof CatalogHttpException httpError) {
      return retryPolicy.isRetryableStatus(httpError.status());
    }
    return false;
  }

  /**
   * Computes the wait before the next attempt, honoring a Retry-After
   * header up to the policy's maximum delay.
   *
   * @param attempt the zero based retry index
   * @param cause   the failure, never null
   * @return the delay, never null
   */
  private Duration delayFor(final int attempt, final CatalogException cause) {
    if (cause instanceof CatalogHttpException httpError
        && httpError.retryAfter().isPresent()) {
      final Duration requested = httpError.retryAfter().get();
      return requested.compareTo(retryPolicy.maxDelay()) > 0
          ? retryPolicy.maxDelay()
          : requested;
    }
    return retryPolicy.delayFor(attempt,
        ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Sleeps before the next attempt. If interrupted, restores the interrupt
   * flag and gives up with the last failure.
   *
   * @param delay the delay, never null
   * @param cause the last failure, never null
   */
  private void sleepOrAbort(final Duration delay,
      final CatalogException cause) {
    try {
      sleeper.sleep(delay);
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.error("{}: retry interrupted", config().name());
      cause.addSuppressed(ie);
      throw cause;
    }
  }
}
