package com.databricks.preserver.input;

import com.databricks.preserver.AsyncSource;
import com.databricks.preserver.CancellationScope;
import com.databricks.preserver.Delivery;
import com.databricks.preserver.PreserverOptions;
import com.databricks.preserver.ReadCancelledException;
import com.databricks.preserver.SourceClosedException;
import com.databricks.preserver.common.backoff.ExponentialBackoff;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps an {@link AsyncSource} and keeps every delivered batch until it is acknowledged
 * successfully. A batch acknowledged with an error is delivered again, before any new data is read
 * from the source, until it succeeds.
 *
 * <p>Useful when the source has no way of rejecting a message (a log-based broker, for example) and
 * failed messages should simply be retried rather than dropped. Delivery is at-least-once; there is
 * no limit on the number of retries.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * AsyncPreserver preserver = new AsyncPreserver(source);
 * CancellationScope scope = CancellationScope.background();
 * preserver.connect(scope);
 * while (true) {
 *     Delivery delivery;
 *     try {
 *         delivery = preserver.readBatch(scope);
 *     } catch (ReadCancelledException e) {
 *         continue; // a failed batch is waiting to be resent
 *     } catch (SourceClosedException e) {
 *         break;
 *     }
 *     executor.submit(() -> {
 *         try {
 *             process(delivery.batch());
 *             delivery.ack().acknowledge(scope, null);
 *         } catch (RuntimeException e) {
 *             delivery.ack().acknowledge(scope, e);
 *         }
 *     });
 * }
 * }</pre>
 *
 * <p>{@link #readBatch} must not be called concurrently with itself. The acknowledgment callbacks it
 * hands out may be invoked from any thread, at any time.
 *
 * <p>Batches are delivered as shallow copies: the payload arrays are shared with the batch kept for
 * resending, so consumers must not modify them in place.
 */
public class AsyncPreserver implements AsyncSource {
  private static final Logger logger = LoggerFactory.getLogger(AsyncPreserver.class);

  private final AsyncSource source;
  private final PreserverOptions options;
  private final ExponentialBackoff backoffPolicy;

  private final ResendQueue resendQueue = new ResendQueue();
  private final DrainCoordinator drain;
  private final AckWrapper ackWrapper;

  /**
   * Creates a preserver with default options.
   *
   * @param source The source to wrap
   */
  public AsyncPreserver(@Nonnull AsyncSource source) {
    this(source, PreserverOptions.getDefault());
  }

  /**
   * Creates a preserver with custom options.
   *
   * @param source The source to wrap
   * @param options Backoff and drain settings
   */
  public AsyncPreserver(@Nonnull AsyncSource source, @Nonnull PreserverOptions options) {
    this.source = Objects.requireNonNull(source, "source cannot be null");
    this.options = Objects.requireNonNull(options, "options cannot be null");
    this.backoffPolicy = options.backoffPolicy();
    this.drain = new DrainCoordinator(options.drainPollIntervalMs());
    this.ackWrapper = new AckWrapper(resendQueue, drain);
  }

  // ==================== AsyncSource ====================

  /**
   * Connects the wrapped source.
   *
   * <p>If the source reports end-of-stream while delivered batches are still unacknowledged, the
   * preserver stays open: the close is reported by {@link #readBatch} once they are resolved.
   *
   * @param scope Scope bounding the attempt
   * @throws SourceClosedException if the source is closed and nothing is pending
   */
  @Override
  public void connect(@Nonnull CancellationScope scope) {
    drain.connect(source, scope);
  }

  /**
   * Reads the next batch: a queued resend if there is one, otherwise fresh data from the source.
   *
   * <p>A fresh read blocked in the source is woken as soon as a delivered batch fails. In that case
   * this method throws {@link ReadCancelledException} and the next call delivers the failed batch.
   *
   * @param scope Scope bounding the read
   * @return The batch and the callback that must acknowledge it
   * @throws ReadCancelledException if the scope ended, the thread was interrupted, or a resend
   *     became available during a fresh read
   * @throws SourceClosedException once the source is closed and every batch is acknowledged
   * @throws com.databricks.preserver.DrainTimeoutException if the scope ended while waiting for
   *     pending acknowledgments of a closed source
   */
  @Override
  @Nonnull
  public Delivery readBatch(@Nonnull CancellationScope scope) {
    Objects.requireNonNull(scope, "scope cannot be null");
    CancellationScope readScope = scope.child();
    try {
      ResendEntry resend = resendQueue.pollOrArm(readScope::cancel);
      if (resend != null) {
        return redeliver(resend, readScope);
      }
      return readFresh(scope, readScope);
    } finally {
      readScope.cancel();
    }
  }

  /**
   * Closes the wrapped source.
   *
   * @param scope Scope bounding the shutdown
   */
  @Override
  public void close(@Nonnull CancellationScope scope) {
    source.close(scope);
  }

  // ==================== Diagnostics ====================

  /** Returns a snapshot of the pending, queued and resent batch counters. */
  @Nonnull
  public PreserverStats stats() {
    return new PreserverStats(
        drain.pendingBatches(),
        resendQueue.size(),
        resendQueue.totalPushed(),
        drain.isSourceClosed());
  }

  /** Returns the options this preserver was created with. */
  @Nonnull
  public PreserverOptions options() {
    return options;
  }

  // ==================== Internal ====================

  private Delivery redeliver(ResendEntry entry, CancellationScope scope) {
    entry.attempts++;
    if (entry.attempts > options.backoffAfterAttempts()) {
      // Free attempts are used up; delay by the batch's own backoff.
      Duration delay = entry.backoff.next();
      logger.debug(
          "Redelivering batch of {} parts after {}us (attempt {})",
          entry.size(),
          delay.toNanos() / 1000,
          entry.attempts);
      sleep(entry, delay, scope);
    } else {
      logger.debug("Redelivering batch of {} parts (attempt {})", entry.size(), entry.attempts);
    }
    return deliver(entry);
  }

  private void sleep(ResendEntry entry, Duration delay, CancellationScope scope) {
    if (delay.isZero()) {
      return;
    }
    try {
      if (scope.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
        abandon(entry);
        throw new ReadCancelledException("Read cancelled during resend backoff", scope.reason());
      }
    } catch (InterruptedException e) {
      abandon(entry);
      Thread.currentThread().interrupt();
      throw new ReadCancelledException("Interrupted during resend backoff", e);
    }
  }

  /** Returns an entry to the head of the queue when its redelivery is cut short. */
  private void abandon(ResendEntry entry) {
    entry.attempts--;
    resendQueue.pushFront(entry);
  }

  private Delivery readFresh(CancellationScope scope, CancellationScope readScope) {
    Delivery delivery;
    try {
      if (drain.isSourceClosed()) {
        throw new SourceClosedException("Source closed");
      }
      delivery = source.readBatch(readScope);
    } catch (SourceClosedException e) {
      throw drain.awaitDrained(scope, readScope, e);
    }
    Objects.requireNonNull(delivery, "source returned a null delivery");
    drain.batchDelivered();
    return deliver(new ResendEntry(delivery.batch(), delivery.ack(), backoffPolicy.start()));
  }

  private Delivery deliver(ResendEntry entry) {
    Delivery wrapped = ackWrapper.wrap(entry);
    return Delivery.of(wrapped.batch().shallowCopy(), wrapped.ack());
  }
}
