package org.waabox.completist.job;

/**
 * The lifecycle of an analysis job.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum JobState {

  /** Never started. */
  IDLE,

  /** A run is in progress. */
  RUNNING,

  /** The last run was cancelled. */
  CANCELLED,

  /** The last run went through every unit. */
  COMPLETED,

  /** The last run stopped on a fatal error, such as a failed checkpoint. */
  FAILED
}
