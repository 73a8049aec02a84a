package com.databricks.preserver.input;

import com.databricks.preserver.AsyncSource;
import com.databricks.preserver.CancellationScope;
import com.databricks.preserver.DrainTimeoutException;
import com.databricks.preserver.PreserverException;
import com.databricks.preserver.ReadCancelledException;
import com.databricks.preserver.SourceClosedException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds back the source's end-of-stream signal until every delivered batch is acknowledged.
 *
 * <p>Counts batches that were read from the source and not yet acknowledged successfully. While that
 * count is above zero, a closed source is presented as open: {@link #connect} succeeds and reads
 * wait for the remaining acknowledgments instead of reporting the close.
 *
 * <p>The counter and the closed flag are lock-free and not kept consistent with the resend queue. A
 * stale read costs at most one extra poll.
 */
final class DrainCoordinator {
  private static final Logger logger = LoggerFactory.getLogger(DrainCoordinator.class);

  private final AtomicLong pendingBatches = new AtomicLong();
  private final AtomicBoolean sourceClosed = new AtomicBoolean(false);
  private final long pollIntervalMs;

  /**
   * Creates a coordinator.
   *
   * @param pollIntervalMs How often to check outstanding acknowledgments while draining
   */
  DrainCoordinator(long pollIntervalMs) {
    this.pollIntervalMs = pollIntervalMs;
  }

  /**
   * Connects the source, treating end-of-stream as success while batches are pending.
   *
   * @param source The wrapped source
   * @param scope Scope bounding the attempt
   * @throws SourceClosedException if the source is closed and nothing is pending
   */
  void connect(AsyncSource source, CancellationScope scope) {
    try {
      source.connect(scope);
    } catch (SourceClosedException e) {
      long pending = pendingBatches.get();
      if (pending <= 0) {
        throw e;
      }
      if (sourceClosed.compareAndSet(false, true)) {
        logger.info("Source closed with {} batches pending acknowledgment, draining", pending);
      }
    }
  }

  /** Records a batch freshly read from the source. */
  void batchDelivered() {
    pendingBatches.incrementAndGet();
  }

  /** Records the successful acknowledgment of a batch. */
  void batchAcknowledged() {
    pendingBatches.decrementAndGet();
  }

  /** Returns the number of batches read and not yet acknowledged successfully. */
  long pendingBatches() {
    return pendingBatches.get();
  }

  /** Returns true once the source reported end-of-stream while batches were pending. */
  boolean isSourceClosed() {
    return sourceClosed.get();
  }

  /**
   * Waits for pending batches to be acknowledged after the source reported end-of-stream.
   *
   * <p>The wait ends when nothing is pending anymore, when the caller's scope ends, or when the read
   * scope is interrupted because a failed batch was queued for resending.
   *
   * @param callerScope The scope the caller passed to the read
   * @param readScope The child scope of the current read, interruptible by resends
   * @param closed The end-of-stream signal
   * @return The exception the read must throw: {@code closed} once drained, {@link
   *     DrainTimeoutException} if the caller's scope ended, {@link ReadCancelledException} otherwise
   */
  PreserverException awaitDrained(
      CancellationScope callerScope, CancellationScope readScope, SourceClosedException closed) {
    if (pendingBatches.get() <= 0) {
      return closed;
    }
    try {
      while (!readScope.await(pollIntervalMs, TimeUnit.MILLISECONDS)) {
        if (pendingBatches.get() <= 0) {
          logger.info("All pending batches acknowledged, source closed");
          return closed;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new ReadCancelledException("Interrupted while draining pending batches", e);
    }
    long pending = pendingBatches.get();
    if (callerScope.isDone()) {
      logger.warn("Gave up draining with {} batches pending acknowledgment", pending);
      return new DrainTimeoutException(
          "Timed out waiting for " + pending + " pending batches to be acknowledged", pending);
    }
    return new ReadCancelledException(
        "Drain interrupted by a batch queued for resending", readScope.reason());
  }
}
