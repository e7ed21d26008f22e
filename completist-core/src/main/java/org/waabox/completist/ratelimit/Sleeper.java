package org.waabox.completist.ratelimit;

import java.time.Duration;

/**
 * Suspends the calling thread for a given duration.
 *
 * <p>Rate limiters and retry loops wait through this seam so tests can run
 * them against a simulated clock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Waits for the given duration.
   *
   * @param duration the time to wait, never null
   *
   * @throws InterruptedException if the thread is interrupted while
   *                              waiting
   */
  void sleep(Duration duration) throws InterruptedException;

  /**
   * Returns a sleeper backed by {@link Thread#sleep(long)}.
   *
   * @return the system sleeper, never null
   */
  static Sleeper system() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
