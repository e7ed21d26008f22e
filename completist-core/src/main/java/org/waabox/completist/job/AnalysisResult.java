package org.waabox.completist.job;

/**
 * The outcome of a batch analysis.
 *
 * @param completed false when the run was cancelled before the end
 * @param analyzed  the units analyzed
 * @param skipped   the units skipped because their record was fresh
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record AnalysisResult(boolean completed, int analyzed, int skipped) {
}
