package org.waabox.completist;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Defines the retry-with-exponential-backoff behavior for catalog requests.
 *
 * <p>The delay before retry {@code n} (zero based) is
 * {@code initialDelay * factor^n}, capped at {@code maxDelay}, plus a random
 * jitter of up to {@code maxJitter} of that delay.
 *
 * <p>Instances are created through static factory methods. The default
 * policy uses 3 retries, a 1-second initial delay, a factor of 2, a 30-second
 * cap, up to 50% jitter and retries HTTP 429, 500, 502, 503 and 504.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default number of retries. */
  private static final int DEFAULT_MAX_RETRIES = 3;

  /** The default delay before the first retry. */
  private static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);

  /** The default upper bound of a single delay. */
  private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

  /** The default exponential factor. */
  private static final double DEFAULT_FACTOR = 2.0;

  /** The default maximum jitter, as a fraction of the computed delay. */
  private static final double DEFAULT_MAX_JITTER = 0.5;

  /** The HTTP statuses retried by default. */
  private static final Set<Integer> DEFAULT_RETRYABLE_STATUSES =
      Set.of(429, 500, 502, 503, 504);

  /** The maximum number of retry attempts. */
  private final int maxRetries;

  /** The delay before the first retry. */
  private final Duration initialDelay;

  /** The upper bound of a single delay, before jitter. */
  private final Duration maxDelay;

  /** The exponential growth factor. */
  private final double factor;

  /** The maximum jitter, as a fraction of the computed delay. */
  private final double maxJitter;

  /** The HTTP statuses that are worth retrying. */
  private final Set<Integer> retryableStatuses;

  /**
   * Creates a new retry policy.
   *
   * @param maxRetries        the maximum number of retries
   * @param initialDelay      the first delay, never null
   * @param maxDelay          the delay cap, never null
   * @param factor            the growth factor
   * @param maxJitter         the jitter fraction
   * @param retryableStatuses the retryable statuses, never null
   */
  private RetryPolicy(final int maxRetries, final Duration initialDelay,
      final Duration maxDelay, final double factor, final double maxJitter,
      final Set<Integer> retryableStatuses) {
    this.maxRetries = maxRetries;
    this.initialDelay = initialDelay;
    this.maxDelay = maxDelay;
    this.factor = factor;
    this.maxJitter = maxJitter;
    this.retryableStatuses = Set.copyOf(retryableStatuses);
  }

  /**
   * Creates a retry policy with the given number of retries and initial
   * delay, using the default cap, factor, jitter and retryable statuses.
   *
   * @param maxRetries   the maximum number of retry attempts, must be
   *                     greater than zero
   * @param initialDelay the delay before the first retry, never null
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxRetries is less than or equal
   *                                  to zero
   * @throws NullPointerException if initialDelay is null
   */
  public static RetryPolicy of(final int maxRetries,
      final Duration initialDelay) {
    return of(maxRetries, initialDelay, DEFAULT_MAX_DELAY, DEFAULT_FACTOR,
        DEFAULT_MAX_JITTER, DEFAULT_RETRYABLE_STATUSES);
  }

  /**
   * Creates a fully customized retry policy.
   *
   * @param maxRetries        the maximum number of retry attempts, must be
   *                          greater than zero
   * @param initialDelay      the delay before the first retry, never null
   * @param maxDelay          the upper bound of a single delay, never null
   * @param factor            the exponential factor, at least 1
   * @param maxJitter         the jitter fraction, between 0 and 1
   * @param retryableStatuses the HTTP statuses to retry, never null
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if any numeric argument is out of
   *                                  range
   */
  public static RetryPolicy of(final int maxRetries,
      final Duration initialDelay, final Duration maxDelay,
      final double factor, final double maxJitter,
      final Set<Integer> retryableStatuses) {
    if (maxRetries <= 0) {
      throw new IllegalArgumentException(
          "maxRetries must be greater than 0, got: " + maxRetries);
    }
    Objects.requireNonNull(initialDelay, "initialDelay must not be null");
    Objects.requireNonNull(maxDelay, "maxDelay must not be null");
    Objects.requireNonNull(retryableStatuses,
        "retryableStatuses must not be null");
    if (factor < 1.0) {
      throw new IllegalArgumentException(
          "factor must be at least 1, got: " + factor);
    }
    if (maxJitter < 0.0 || maxJitter > 1.0) {
      throw new IllegalArgumentException(
          "maxJitter must be between 0 and 1, got: " + maxJitter);
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException(
          "maxDelay must not be shorter than initialDelay");
    }
    return new RetryPolicy(maxRetries, initialDelay, maxDelay, factor,
        maxJitter, retryableStatuses);
  }

  /**
   * Creates a retry policy with sensible defaults: 3 retries starting at
   * 1 second, doubling up to 30 seconds.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_DELAY,
        DEFAULT_MAX_DELAY, DEFAULT_FACTOR, DEFAULT_MAX_JITTER,
        DEFAULT_RETRYABLE_STATUSES);
  }

  /**
   * Computes the delay before the given retry.
   *
   * @param attempt      the zero based retry index
   * @param jitterSample a sample in {@code [0, 1)} scaling the jitter
   * @return the delay to wait, never null
   */
  public Duration delayFor(final int attempt, final double jitterSample) {
    final double base = initialDelay.toMillis() * Math.pow(factor, attempt);
    final double capped = Math.min(base, maxDelay.toMillis());
    final double jitter = capped * maxJitter * jitterSample;
    return Duration.ofMillis(Math.round(capped + jitter));
  }

  /**
   * Checks whether the given HTTP status is worth retrying.
   *
   * @param status the HTTP status code
   * @return true if the status is retryable
   */
  public boolean isRetryableStatus(final int status) {
    return retryableStatuses.contains(status);
  }

  /**
   * Returns the maximum number of retry attempts.
   *
   * @return the maximum number of retries, always greater than zero
   */
  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Returns the delay before the first retry.
   *
   * @return the initial delay, never null
   */
  public Duration initialDelay() {
    return initialDelay;
  }

  /**
   * Returns the upper bound of a single delay, before jitter.
   *
   * @return the maximum delay, never null
   */
  public Duration maxDelay() {
    return maxDelay;
  }

  /**
   * Returns the exponential growth factor.
   *
   * @return the factor, at least 1
   */
  public double factor() {
    return factor;
  }

  /**
   * Returns the maximum jitter fraction.
   *
   * @return the jitter, between 0 and 1
   */
  public double maxJitter() {
    return maxJitter;
  }
}
