package org.waabox.completist.job;

/**
 * The counters of one phase run by the {@link BatchJobRunner}.
 *
 * @param cancelled whether the phase stopped on cancellation
 * @param analyzed  the units processed successfully
 * @param skipped   the units skipped as fresh
 * @param failed    the units whose processing threw
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record BatchOutcome(boolean cancelled, int analyzed, int skipped,
    int failed) {
}
