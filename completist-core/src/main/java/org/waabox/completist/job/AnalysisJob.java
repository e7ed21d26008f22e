package org.waabox.completist.job;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.AnalysisInProgressException;
import org.waabox.completist.model.Scope;
import org.waabox.completist.store.LibraryStore;

/**
 * A batch analysis of one domain.
 *
 * <p>A run goes through {@code IDLE -> RUNNING -> COMPLETED | CANCELLED |
 * FAILED}. Preconditions such as catalog credentials are verified before
 * the job leaves its current state, so a failing check never starts a
 * run. The store's write batch is opened for the whole run and closed on
 * every exit path.
 *
 * <p>Jobs sharing a run slot cannot overlap: the store's write batch is a
 * single shared resource. Starting a job while any job of the same slot
 * is running throws {@link AnalysisInProgressException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public abstract class AnalysisJob {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      AnalysisJob.class);

  /** The job name, never null. */
  private final String name;

  /** The store whose write batch wraps the run, never null. */
  private final LibraryStore store;

  /** The name of the job currently running in the slot, null if none. */
  private final AtomicReference<String> runSlot;

  /** Guards the slot claim together with the token switch. */
  private final Object runLock = new Object();

  /** The token of the current or last run. */
  private volatile CancellationToken token = new CancellationToken();

  /** The current state. */
  private volatile JobState state = JobState.IDLE;

  /**
   * Creates a new job.
   *
   * @param theName    the job name, never null
   * @param theStore   the store, never null
   * @param theRunSlot the slot shared by jobs that cannot overlap, never
   *                   null
   */
  protected AnalysisJob(final String theName, final LibraryStore theStore,
      final AtomicReference<String> theRunSlot) {
    name = Objects.requireNonNull(theName, "name must not be null");
    store = Objects.requireNonNull(theStore, "store must not be null");
    runSlot = Objects.requireNonNull(theRunSlot, "runSlot must not be null");
  }

  /**
   * Runs the analysis over every unit in the scope.
   *
   * @param scope    the scope to analyze, never null
   * @param options  the run options, never null
   * @param listener the progress listener, never null
   * @return the run result, never null
   *
   * @throws AnalysisInProgressException if a job of the same slot is
   *         running
   * @throws org.waabox.completist.MissingCredentialsException if the
   *         catalog credentials are not configured
   */
  public final AnalysisResult run(final Scope scope,
      final AnalysisOptions options, final ProgressListener listener) {
    Objects.requireNonNull(scope, "scope must not be null");
    Objects.requireNonNull(options, "options must not be null");
    Objects.requireNonNull(listener, "listener must not be null");

    verifyPreconditions();

    final CancellationToken runToken = new CancellationToken();
    synchronized (runLock) {
      final String running = runSlot.compareAndExchange(null, name);
      if (running != null) {
        throw new AnalysisInProgressException(running);
      }
      token = runToken;
      state = JobState.RUNNING;
    }
    log.info("Starting {} analysis for scope {}", name, scope.key());

    try {
      store.beginWriteBatch();
      try {
        final AnalysisResult result = execute(scope, options, runToken,
            listener);
        state = result.completed() ? JobState.COMPLETED : JobState.CANCELLED;
        log.info("{} analysis {}: {} analyzed, {} skipped", name,
            state.name().toLowerCase(), result.analyzed(), result.skipped());
        return result;
      } finally {
        store.endWriteBatch();
      }
    } catch (final RuntimeException e) {
      state = JobState.FAILED;
      log.error("{} analysis failed: {}", name, e.getMessage(), e);
      throw e;
    } finally {
      runSlot.set(null);
    }
  }

  /**
   * Asks the current run to stop at the next batch boundary. Requests
   * already in flight are not interrupted. Once a run holds the slot, it
   * sees every later cancellation.
   */
  public void cancel() {
    log.info("Cancelling {} analysis", name);
    synchronized (runLock) {
      token.cancel();
    }
  }

  /**
   * Returns the current state.
   *
   * @return the state, never null
   */
  public JobState state() {
    return state;
  }

  /**
   * Returns the job name.
   *
   * @return the name, never null
   */
  public String name() {
    return name;
  }

  /**
   * Checks what must hold before any work starts. The default checks
   * nothing.
   */
  protected void verifyPreconditions() {
  }

  /**
   * Performs the analysis inside the write batch.
   *
   * @param scope    the scope to analyze, never null
   * @param options  the run options, never null
   * @param token    the cancellation token of this run, never null
   * @param listener the progress listener, never null
   * @return the run result, never null
   */
  protected abstract AnalysisResult execute(Scope scope,
      AnalysisOptions options, CancellationToken token,
      ProgressListener listener);
}
