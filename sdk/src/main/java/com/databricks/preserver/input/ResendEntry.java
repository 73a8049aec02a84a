package com.databricks.preserver.input;

import com.databricks.preserver.AckFunction;
import com.databricks.preserver.common.backoff.ExponentialBackoff;
import com.databricks.preserver.message.MessageBatch;

/**
 * Tracks a batch that has been read from the source but not yet successfully acknowledged.
 *
 * <p>The same entry follows a batch through every redelivery until it succeeds. Only the reader
 * thread touches {@link #attempts} and {@link #backoff}; {@link #batch} is narrowed by the
 * acknowledging thread before the entry is queued, and the queue's lock publishes the change.
 */
final class ResendEntry {

  /**
   * Parts still awaiting a successful acknowledgment.
   *
   * <p>Mutable because a partially failed batch is narrowed down to its failed parts before it is
   * queued for resending.
   */
  MessageBatch batch;

  /** Acknowledgment callback of the source, invoked once the batch finally succeeds. */
  final AckFunction sourceAck;

  /** Number of times this batch has been redelivered. */
  int attempts;

  /** Pacing for redeliveries past the undelayed ones. */
  final ExponentialBackoff.Sequence backoff;

  /**
   * Creates a new entry for a freshly read batch.
   *
   * @param batch The batch as read from the source
   * @param sourceAck The source's acknowledgment callback
   * @param backoff A fresh backoff sequence owned by this entry
   */
  ResendEntry(MessageBatch batch, AckFunction sourceAck, ExponentialBackoff.Sequence backoff) {
    this.batch = batch;
    this.sourceAck = sourceAck;
    this.backoff = backoff;
  }

  /** Returns the number of parts in this entry's batch. */
  int size() {
    return batch.size();
  }
}
