package com.databricks.preserver;

import com.databricks.preserver.message.MessageBatch;
import java.util.Objects;
import javax.annotation.Nonnull;

/** A batch handed to a consumer together with the callback that acknowledges it. */
public final class Delivery {

  private final MessageBatch batch;
  private final AckFunction ack;

  private Delivery(MessageBatch batch, AckFunction ack) {
    this.batch = batch;
    this.ack = ack;
  }

  /**
   * Creates a delivery.
   *
   * @param batch The delivered batch
   * @param ack The callback acknowledging the batch
   * @return A new delivery
   */
  @Nonnull
  public static Delivery of(@Nonnull MessageBatch batch, @Nonnull AckFunction ack) {
    return new Delivery(
        Objects.requireNonNull(batch, "batch cannot be null"),
        Objects.requireNonNull(ack, "ack cannot be null"));
  }

  /** Returns the delivered batch. */
  @Nonnull
  public MessageBatch batch() {
    return batch;
  }

  /** Returns the callback that must be invoked exactly once for this batch. */
  @Nonnull
  public AckFunction ack() {
    return ack;
  }
}
