package org.waabox.completist;

/**
 * Thrown when a batch analysis is started on a job that is already
 * running.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AnalysisInProgressException extends CompletistException {

  private static final long serialVersionUID = 1L;

  /** The name of the job that is already running, never null. */
  private final String jobName;

  /** Creates a new exception for the given job.
   *
   * @param theJobName the name of the running job, cannot be null.
   */
  public AnalysisInProgressException(final String theJobName) {
    super("Analysis '" + theJobName + "' is already running");
    jobName = theJobName;
  }

  /** Returns the name of the job that is already running.
   *
   * @return the job name, never null.
   */
  public String jobName() {
    return jobName;
  }
}
