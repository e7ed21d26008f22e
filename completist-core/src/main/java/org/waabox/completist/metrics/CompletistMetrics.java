package org.waabox.completist.metrics;

/**
 * An abstraction for recording operational metrics of the completeness
 * engine.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopCompletistMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CompletistMetrics {

  /**
   * Records a logical unit that was analyzed.
   *
   * @param domain     the analysis domain (e.g. "series", "collections"),
   *                   never null
   * @param durationMs the time spent analyzing the unit, in milliseconds
   */
  void unitAnalyzed(String domain, long durationMs);

  /**
   * Records a logical unit that was skipped because its record is fresh.
   *
   * @param domain the analysis domain, never null
   */
  void unitSkipped(String domain);

  /**
   * Records a logical unit whose analysis failed.
   *
   * @param domain the analysis domain, never null
   * @param cause  the throwable that caused the failure, never null
   */
  void unitFailed(String domain, Throwable cause);

  /**
   * Records a catalog request that is about to be retried.
   *
   * @param catalogName the name of the catalog, never null
   * @param attempt     the one based retry number
   * @param cause       the failure that triggered the retry, never null
   */
  void requestRetried(String catalogName, int attempt, Throwable cause);

  /**
   * Records a catalog response served from the response cache.
   *
   * @param catalogName the name of the catalog, never null
   */
  void cacheHit(String catalogName);
}
