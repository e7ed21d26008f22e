package org.waabox.completist.job;

/**
 * A progress report of a batch analysis.
 *
 * @param current     the units processed so far in the phase
 * @param total       the units of the phase
 * @param currentItem the unit being processed, may be null
 * @param phase       the phase, such as "scanning" or "complete"
 * @param skipped     the units skipped so far in the phase
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record AnalysisProgress(int current, int total, String currentItem,
    String phase, int skipped) {

  /**
   * Returns the progress of the phase as a percentage.
   *
   * @return a value between 0 and 100, 100 when the phase is empty
   */
  public int percentage() {
    if (total <= 0) {
      return 100;
    }
    return (int) Math.min(100, Math.round(current * 100.0 / total));
  }
}
