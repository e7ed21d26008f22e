package org.waabox.completist.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link RateLimiter} that never lets more than {@code maxRequests}
 * requests through within any {@code window}.
 *
 * <p>The timestamps of the requests issued inside the current window are
 * kept in arrival order. When the window is full the caller waits until the
 * oldest one leaves it, plus a small buffer, and checks again.
 *
 * <p>Waiters are served in arrival order: the lock is fair and is held
 * while waiting.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SlidingWindowRateLimiter implements RateLimiter {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      SlidingWindowRateLimiter.class);

  /** The maximum number of requests inside one window. */
  private final int maxRequests;

  /** The window length. */
  private final Duration window;

  /** The extra wait added when the window is full. */
  private final Duration buffer;

  /** The clock used to timestamp requests. */
  private final Clock clock;

  /** The sleeper used to wait for a free slot. */
  private final Sleeper sleeper;

  /** The epoch millis of the requests issued in the current window. */
  private final Deque<Long> timestamps = new ArrayDeque<>();

  /** Guards the timestamps. */
  private final ReentrantLock lock = new ReentrantLock(true);

  /**
   * Creates a new sliding window rate limiter.
   *
   * @param maxRequests the maximum requests per window, greater than zero
   * @param window      the window length, never null
   * @param buffer      the extra wait when the window is full, never null
   * @param clock       the clock, never null
   * @param sleeper     the sleeper, never null
   */
  public SlidingWindowRateLimiter(final int maxRequests,
      final Duration window, final Duration buffer, final Clock clock,
      final Sleeper sleeper) {
    if (maxRequests <= 0) {
      throw new IllegalArgumentException(
          "maxRequests must be greater than 0, got: " + maxRequests);
    }
    this.maxRequests = maxRequests;
    this.window = Objects.requireNonNull(window, "window must not be null");
    this.buffer = Objects.requireNonNull(buffer, "buffer must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public void acquire() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      long now = clock.millis();
      prune(now);
      while (timestamps.size() >= maxRequests) {
        final long oldest = timestamps.peekFirst();
        final long waitMs = window.toMillis() - (now - oldest)
            + buffer.toMillis();
        log.debug("Rate limit of {} per {} ms reached, waiting {} ms",
            maxRequests, window.toMillis(), waitMs);
        sleeper.sleep(Duration.ofMillis(Math.max(waitMs, 0)));
        now = clock.millis();
        prune(now);
      }
      timestamps.addLast(now);
    } finally {
      lock.unlock();
    }
  }

  /** {@inheritDoc} */
  @Override
  public void reset() {
    lock.lock();
    try {
      timestamps.clear();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a snapshot of the current usage of the window.
   *
   * @return the limiter statistics, never null
   */
  public Stats stats() {
    lock.lock();
    try {
      prune(clock.millis());
      return new Stats(timestamps.size(), maxRequests, window);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Drops the timestamps that already left the window.
   *
   * @param now the current epoch millis
   */
  private void prune(final long now) {
    while (!timestamps.isEmpty()
        && now - timestamps.peekFirst() >= window.toMillis()) {
      timestamps.pollFirst();
    }
  }

  /**
   * The usage of a sliding window.
   *
   * @param requestsInWindow the requests issued in the current window
   * @param maxRequests      the window capacity
   * @param window           the window length
   */
  public record Stats(int requestsInWindow, int maxRequests,
      Duration window) {
  }
}
