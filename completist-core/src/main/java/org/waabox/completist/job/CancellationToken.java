package org.waabox.completist.job;

/**
 * A cooperative cancellation flag for one analysis run.
 *
 * <p>A new token is handed to every run. Cancelling only affects the next
 * loop boundary: requests already in flight complete normally.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CancellationToken {

  /** Whether cancellation was requested. */
  private volatile boolean cancelled;

  /** Requests cancellation. */
  public void cancel() {
    cancelled = true;
  }

  /**
   * Tells whether cancellation was requested.
   *
   * @return true once {@link #cancel()} was called
   */
  public boolean isCancelled() {
    return cancelled;
  }
}
