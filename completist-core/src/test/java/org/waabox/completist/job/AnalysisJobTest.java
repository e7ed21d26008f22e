package org.waabox.completist.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.waabox.completist.AnalysisInProgressException;
import org.waabox.completist.model.Scope;
import org.waabox.completist.store.InMemoryLibraryStore;

/**
 * Tests for {@link AnalysisJob}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class AnalysisJobTest {

  @Test
  void whenCancelling_givenRunThatJustClaimedTheSlot_shouldCancelThatRun()
      throws Exception {
    for (int i = 0; i < 200; i++) {
      // Arrange
      final AtomicReference<String> slot = new AtomicReference<>();
      final CountDownLatch release = new CountDownLatch(1);
      final BlockingJob job = new BlockingJob(slot, release);

      // Act
      final CompletableFuture<AnalysisResult> run = CompletableFuture
          .supplyAsync(() -> job.run(Scope.all(), AnalysisOptions.defaults(),
              ProgressListener.none()));
      while (slot.get() == null && !run.isDone()) {
        Thread.onSpinWait();
      }
      job.cancel();
      release.countDown();
      final AnalysisResult result = run.get(5, TimeUnit.SECONDS);

      // Assert
      assertFalse(result.completed(), "cancel lost on attempt " + i);
      assertEquals(JobState.CANCELLED, job.state());
      assertNull(slot.get());
    }
  }

  @Test
  void whenCancelling_givenIdleJob_shouldNotCancelTheNextRun() {
    final CountDownLatch release = new CountDownLatch(0);
    final BlockingJob job = new BlockingJob(new AtomicReference<>(),
        release);

    job.cancel();
    final AnalysisResult result = job.run(Scope.all(),
        AnalysisOptions.defaults(), ProgressListener.none());

    assertTrue(result.completed());
    assertEquals(JobState.COMPLETED, job.state());
  }

  @Test
  void whenRunning_givenSlotTakenByAnotherJob_shouldKeepItsState() {
    final AtomicReference<String> slot = new AtomicReference<>("music");
    final BlockingJob job = new BlockingJob(slot, new CountDownLatch(0));

    assertThrows(AnalysisInProgressException.class, () -> job.run(
        Scope.all(), AnalysisOptions.defaults(), ProgressListener.none()));

    assertEquals(JobState.IDLE, job.state());
    assertEquals("music", slot.get());
  }

  /** A job that waits for a latch and reports whether it was cancelled. */
  private static final class BlockingJob extends AnalysisJob {

    /** The latch the run waits on. */
    private final CountDownLatch release;

    BlockingJob(final AtomicReference<String> theSlot,
        final CountDownLatch theRelease) {
      super("blocking", new InMemoryLibraryStore(), theSlot);
      release = theRelease;
    }

    @Override
    protected AnalysisResult execute(final Scope scope,
        final AnalysisOptions options, final CancellationToken token,
        final ProgressListener listener) {
      try {
        release.await();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException(e);
      }
      return new AnalysisResult(!token.isCancelled(), 0, 0);
    }
  }
}
