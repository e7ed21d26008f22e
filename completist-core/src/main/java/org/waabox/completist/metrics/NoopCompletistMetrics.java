package org.waabox.completist.metrics;

/**
 * A no-operation implementation of {@link CompletistMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopCompletistMetrics implements CompletistMetrics {

  /** {@inheritDoc} */
  @Override
  public void unitAnalyzed(final String domain, final long durationMs) {
  }

  /** {@inheritDoc} */
  @Override
  public void unitSkipped(final String domain) {
  }

  /** {@inheritDoc} */
  @Override
  public void unitFailed(final String domain, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void requestRetried(final String catalogName, final int attempt,
      final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void cacheHit(final String catalogName) {
  }
}
