package com.databricks.preserver.input;

import com.databricks.preserver.AckFunction;
import com.databricks.preserver.CancellationScope;
import com.databricks.preserver.Delivery;
import com.databricks.preserver.message.MessageBatch;
import com.databricks.preserver.message.Part;
import com.databricks.preserver.message.SortGroup;
import com.databricks.preserver.message.WalkableError;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces the acknowledgment callback of every delivered batch with one that queues failures for
 * resending.
 *
 * <p>A failure is absorbed: the wrapped callback returns normally and the batch, or the failed
 * subset of it, is pushed to the {@link ResendQueue}. A success is forwarded to the source's own
 * callback, which therefore sees exactly one acknowledgment per batch read.
 */
final class AckWrapper {
  private static final Logger logger = LoggerFactory.getLogger(AckWrapper.class);

  private final ResendQueue resendQueue;
  private final DrainCoordinator drain;

  AckWrapper(ResendQueue resendQueue, DrainCoordinator drain) {
    this.resendQueue = resendQueue;
    this.drain = drain;
  }

  /**
   * Wraps an entry for delivery.
   *
   * @param entry The batch about to be delivered
   * @return The batch to hand out and its wrapped callback
   */
  Delivery wrap(ResendEntry entry) {
    if (entry.size() == 1) {
      return Delivery.of(
          entry.batch, guarded(entry, (scope, error) -> onSingleAck(entry, scope, error)));
    }
    SortGroup sortGroup = new SortGroup();
    MessageBatch tracked = sortGroup.track(entry.batch);
    return Delivery.of(
        tracked, guarded(entry, (scope, error) -> onBatchAck(entry, sortGroup, scope, error)));
  }

  private void onSingleAck(ResendEntry entry, CancellationScope scope, Throwable error) {
    if (error != null) {
      logger.debug("Single part batch failed, queued for resend: {}", error.getMessage());
      resendQueue.push(entry);
      return;
    }
    succeed(entry, scope);
  }

  private void onBatchAck(
      ResendEntry entry, SortGroup sortGroup, CancellationScope scope, Throwable error) {
    if (error != null) {
      MessageBatch original = entry.batch;
      entry.batch = resendSubset(original, sortGroup, error);
      logger.debug(
          "Batch of {} parts failed, queued {} parts for resend: {}",
          original.size(),
          entry.batch.size(),
          error.getMessage());
      resendQueue.push(entry);
      return;
    }
    succeed(entry, scope);
  }

  /**
   * Works out which parts of a failed batch must be sent again.
   *
   * <p>Only a {@link WalkableError} that blames fewer parts than the batch holds narrows the batch.
   * If any blamed part cannot be traced back to the original batch, or nothing is blamed, the whole
   * batch is resent.
   */
  static MessageBatch resendSubset(MessageBatch original, SortGroup sortGroup, Throwable error) {
    if (!(error instanceof WalkableError)) {
      return original;
    }
    WalkableError walkable = (WalkableError) error;
    if (walkable.indexedErrors() >= original.size()) {
      return original;
    }
    List<Part> failed = new ArrayList<>();
    AtomicBoolean untraceable = new AtomicBoolean(false);
    walkable.walkParts(
        (index, part, partError) -> {
          if (partError == null) {
            return true;
          }
          int originalIndex = sortGroup.index(part);
          if (originalIndex >= 0 && originalIndex < original.size()) {
            failed.add(original.get(originalIndex));
            return true;
          }
          untraceable.set(true);
          return false;
        });
    if (untraceable.get()) {
      logger.debug("Failed part could not be traced to the original batch, resending all parts");
      return original;
    }
    if (failed.isEmpty()) {
      return original;
    }
    return MessageBatch.of(failed);
  }

  private void succeed(ResendEntry entry, CancellationScope scope) {
    drain.batchAcknowledged();
    entry.sourceAck.acknowledge(scope, null);
  }

  private static AckFunction guarded(ResendEntry entry, AckFunction ack) {
    AtomicBoolean invoked = new AtomicBoolean(false);
    return (scope, error) -> {
      if (!invoked.compareAndSet(false, true)) {
        logger.warn(
            "Ignoring repeated acknowledgment of a batch of {} parts (attempt {})",
            entry.size(),
            entry.attempts);
        return;
      }
      ack.acknowledge(scope, error);
    };
  }
}
