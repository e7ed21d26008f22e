package org.waabox.completist.ratelimit;

import java.time.Clock;
import java.time.Duration;

/**
 * Factory of the rate limiters used by the bundled catalogs.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RateLimiters {

  /** Film/TV catalog: 40 requests per second. */
  private static final int VIDEO_MAX_REQUESTS = 40;

  /** Film/TV catalog window. */
  private static final Duration VIDEO_WINDOW = Duration.ofSeconds(1);

  /** Film/TV catalog safety buffer. */
  private static final Duration VIDEO_BUFFER = Duration.ofMillis(25);

  /** Music catalog: one request every 1.5 seconds. */
  private static final Duration MUSIC_DELAY = Duration.ofMillis(1500);

  /** Private constructor to prevent instantiation. */
  private RateLimiters() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Creates the limiter for the film/TV catalog: at most 40 requests in
   * any second, waiting 25 ms extra when the window is full.
   *
   * @return a new limiter on the system clock, never null
   */
  public static SlidingWindowRateLimiter video() {
    return new SlidingWindowRateLimiter(VIDEO_MAX_REQUESTS, VIDEO_WINDOW,
        VIDEO_BUFFER, Clock.systemUTC(), Sleeper.system());
  }

  /**
   * Creates the limiter for the music catalog: one request every 1.5
   * seconds.
   *
   * @return a new limiter on the system clock, never null
   */
  public static FixedDelayRateLimiter music() {
    return new FixedDelayRateLimiter(MUSIC_DELAY, Clock.systemUTC(),
        Sleeper.system());
  }
}
