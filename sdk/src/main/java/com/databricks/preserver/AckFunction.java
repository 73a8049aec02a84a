package com.databricks.preserver;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Completion callback for a delivered batch.
 *
 * <p>Every {@link Delivery} carries one. The consumer invokes it exactly once after processing the
 * batch: with a null error on success, or with the cause of the failure otherwise. A failure may be
 * a {@link com.databricks.preserver.message.WalkableError} describing which individual parts of the
 * batch failed.
 *
 * <p>Implementations must be thread-safe: acknowledgments for different batches may arrive
 * concurrently from independent threads, and concurrently with a read in progress.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * Delivery delivery = source.readBatch(scope);
 * try {
 *     process(delivery.batch());
 *     delivery.ack().acknowledge(scope, null);
 * } catch (RuntimeException e) {
 *     delivery.ack().acknowledge(scope, e);
 * }
 * }</pre>
 */
@FunctionalInterface
public interface AckFunction {

  /**
   * Reports the processing outcome of a delivered batch.
   *
   * @param scope Scope bounding any blocking work done while acknowledging
   * @param error The processing failure, or null on success
   * @throws PreserverException if the acknowledgment itself could not be completed
   */
  void acknowledge(@Nonnull CancellationScope scope, @Nullable Throwable error);

  /** Returns an ack function that does nothing, for sources without acknowledgment semantics. */
  static AckFunction noop() {
    return (scope, error) -> {};
  }
}
