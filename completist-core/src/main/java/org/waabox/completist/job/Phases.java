package org.waabox.completist.job;

/**
 * The phase names reported by the analysis jobs.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Phases {

  /** Owned items are being read and grouped. */
  public static final String SCANNING = "scanning";

  /** Series are being diffed against the catalog. */
  public static final String ANALYZING = "analyzing";

  /** Collections are being fetched and diffed. */
  public static final String FETCHING = "fetching";

  /** Artist discographies are being diffed. */
  public static final String ARTISTS = "artists";

  /** Album tracklists are being diffed. */
  public static final String ALBUMS = "albums";

  /** The run is over. */
  public static final String COMPLETE = "complete";

  /** Constants holder. */
  private Phases() {
  }

  /**
   * Turns the outcome of the last phase into the run result, reporting
   * the {@link #COMPLETE} phase unless the run was cancelled.
   *
   * @param outcome  the outcome of the last phase, never null
   * @param total    the number of units of the last phase
   * @param listener the progress listener, never null
   * @return the run result, never null
   */
  static AnalysisResult finish(final BatchOutcome outcome, final int total,
      final ProgressListener listener) {
    if (!outcome.cancelled()) {
      listener.onProgress(new AnalysisProgress(total, total, "", COMPLETE,
          outcome.skipped()));
    }
    return new AnalysisResult(!outcome.cancelled(), outcome.analyzed(),
        outcome.skipped());
  }
}
