package org.waabox.completist.ratelimit;

/**
 * Bounds the outbound request rate to an external catalog.
 *
 * <p>Every uncached request must call {@link #acquire()} before it is
 * dispatched. Implementations must be safe to call from several threads.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RateLimiter {

  /**
   * Blocks until a request slot is available and claims it.
   *
   * @throws InterruptedException if the thread is interrupted while
   *                              waiting for a slot
   */
  void acquire() throws InterruptedException;

  /** Forgets every previously issued request. */
  void reset();
}
