package org.waabox.completist.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link RateLimiter} that keeps a minimum gap between two consecutive
 * requests.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FixedDelayRateLimiter implements RateLimiter {

  /** Marks that no request was issued yet. */
  private static final long NEVER = Long.MIN_VALUE;

  /** The minimum gap between two requests. */
  private final Duration delay;

  /** The clock used to timestamp requests. */
  private final Clock clock;

  /** The sleeper used to wait for the gap. */
  private final Sleeper sleeper;

  /** Guards lastRequest. */
  private final ReentrantLock lock = new ReentrantLock(true);

  /** The epoch millis of the last request, or {@link #NEVER}. */
  private long lastRequest = NEVER;

  /**
   * Creates a new fixed delay rate limiter.
   *
   * @param delay   the minimum gap between two requests, never null
   * @param clock   the clock, never null
   * @param sleeper the sleeper, never null
   */
  public FixedDelayRateLimiter(final Duration delay, final Clock clock,
      final Sleeper sleeper) {
    this.delay = Objects.requireNonNull(delay, "delay must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public void acquire() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      if (lastRequest != NEVER) {
        final long elapsed = clock.millis() - lastRequest;
        final long waitMs = delay.toMillis() - elapsed;
        if (waitMs > 0) {
          sleeper.sleep(Duration.ofMillis(waitMs));
        }
      }
      lastRequest = clock.millis();
    } finally {
      lock.unlock();
    }
  }

  /** {@inheritDoc} */
  @Override
  public void reset() {
    lock.lock();
    try {
      lastRequest = NEVER;
    } finally {
      lock.unlock();
    }
  }
}
