package org.waabox.completist.job;

/**
 * Receives progress reports from a batch analysis.
 *
 * <p>Reports are emitted from the thread that drives the run.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ProgressListener {

  /**
   * Called with every progress report.
   *
   * @param progress the report, never null
   */
  void onProgress(AnalysisProgress progress);

  /**
   * Returns a listener that ignores every report.
   *
   * @return the listener, never null
   */
  static ProgressListener none() {
    return progress -> { };
  }
}
