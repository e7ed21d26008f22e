package org.waabox.completist.job;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.completist.metrics.CompletistMetrics;
import org.waabox.completist.store.LibraryStore;

/**
 * Runs one phase of an analysis over many units.
 *
 * <p>Units are processed in fixed-size batches in enumeration order. The
 * units of a batch run concurrently on the executor and the runner waits
 * for the whole batch before starting the next one. The cancellation
 * token is checked before each batch, so a cancelled run still finishes
 * the batch in flight.
 *
 * <p>A unit that throws is logged and counted as failed; the run goes on.
 * The one exception is a storage failure, which aborts the run once the
 * other units of its batch have finished. Every
 * {@link AnalysisOptions#checkpointEvery()} analyzed units the store is
 * asked for a checkpoint, and a failing checkpoint aborts the run too.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BatchJobRunner {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      BatchJobRunner.class);

  /** The store that receives the checkpoints, never null. */
  private final LibraryStore store;

  /** The executor running the units of a batch, never null. */
  private final Executor executor;

  /** The metrics reporter, never null. */
  private final CompletistMetrics metrics;

  /**
   * Creates a new runner.
   *
   * @param theStore    the store to checkpoint, never null
   * @param theExecutor the executor running the units, never null
   * @param theMetrics  the metrics reporter, never null
   */
  public BatchJobRunner(final LibraryStore theStore,
      final Executor theExecutor, final CompletistMetrics theMetrics) {
    store = Objects.requireNonNull(theStore, "store must not be null");
    executor = Objects.requireNonNull(theExecutor,
        "executor must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Runs a phase.
   *
   * @param <U>      the unit type
   * @param domain   the analysis domain, used in logs and metrics, never
   *                 null
   * @param phase    the phase name reported to the listener, never null
   * @param units    the units in enumeration order, never null
   * @param task     the per-unit work, never null
   * @param options  the run options, never null
   * @param token    the cancellation token, never null
   * @param listener the progress listener, never null
   * @return the phase counters, never null
   *
   * @throws UncheckedIOException if the store fails to persist
   */
  public <U> BatchOutcome run(final String domain, final String phase,
      final List<U> units, final UnitTask<U> task,
      final AnalysisOptions options, final CancellationToken token,
      final ProgressListener listener) {

    Objects.requireNonNull(domain, "domain must not be null");
    Objects.requireNonNull(phase, "phase must not be null");
    Objects.requireNonNull(units, "units must not be null");
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(options, "options must not be null");
    Objects.requireNonNull(token, "token must not be null");
    Objects.requireNonNull(listener, "listener must not be null");

    final int total = units.size();
    final int batchSize = options.concurrency();

    int analyzed = 0;
    int skipped = 0;
    int failed = 0;
    int sinceCheckpoint = 0;
    boolean cancelled = false;

    log.info("{}: {} phase started with {} units", domain, phase, total);

    for (int start = 0; start < total; start += batchSize) {
      if (token.isCancelled()) {
        log.info("{}: cancelled at {}/{}", domain, start, total);
        cancelled = true;
        break;
      }

      final List<U> batch = units.subList(start,
          Math.min(start + batchSize, total));
      final List<CompletableFuture<Boolean>> futures = new ArrayList<>();

      int position = start;
      for (final U unit : batch) {
        final String description = task.describe(unit);
        listener.onProgress(new AnalysisProgress(position, total,
            description, phase, skipped));
        position++;

        if (options.skipRecentlyAnalyzed() && task.isFresh(unit)) {
          log.debug("{}: skipping '{}', analyzed recently", domain,
              description);
          metrics.unitSkipped(domain);
          skipped++;
          continue;
        }
        futures.add(CompletableFuture.supplyAsync(
            () -> process(domain, description, unit, task), executor));
      }

      RuntimeException storageFailure = null;
      for (final CompletableFuture<Boolean> future : futures) {
        try {
          if (await(future)) {
            analyzed++;
            sinceCheckpoint++;
          } else {
            failed++;
          }
        } catch (final RuntimeException e) {
          if (storageFailure == null) {
            storageFailure = e;
          } else {
            storageFailure.addSuppressed(e);
          }
        }
      }
      if (storageFailure != null) {
        log.error("{}: {} phase aborted by a storage failure", domain, phase);
        throw storageFailure;
      }

      if (sinceCheckpoint >= options.checkpointEvery()) {
        log.debug("{}: checkpoint after {} analyzed units", domain,
            analyzed);
        store.forceCheckpoint();
        sinceCheckpoint = 0;
      }
    }

    log.info("{}: {} phase {} with {} analyzed, {} skipped and {} failed",
        domain, phase, cancelled ? "cancelled" : "finished", analyzed,
        skipped, failed);

    return new BatchOutcome(cancelled, analyzed, skipped, failed);
  }

  /**
   * Processes one unit, converting any failure but a storage one into a
   * false result.
   *
   * @return true if the unit was analyzed
   */
  private <U> boolean process(final String domain, final String description,
      final U unit, final UnitTask<U> task) {
    final long startNanos = System.nanoTime();
    try {
      task.process(unit);
      metrics.unitAnalyzed(domain, TimeUnit.NANOSECONDS.toMillis(
          System.nanoTime() - startNanos));
      return true;
    } catch (final UncheckedIOException e) {
      throw e;
    } catch (final RuntimeException e) {
      log.warn("{}: failed to analyze '{}': {}", domain, description,
          e.getMessage(), e);
      metrics.unitFailed(domain, e);
      return false;
    }
  }

  /**
   * Waits for a unit, unwrapping storage failures.
   *
   * @param future the unit future, never null
   * @return true if the unit was analyzed
   */
  private static boolean await(final CompletableFuture<Boolean> future) {
    try {
      return future.join();
    } catch (final CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }
}
