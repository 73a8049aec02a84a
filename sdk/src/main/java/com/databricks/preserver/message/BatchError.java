package com.databricks.preserver.message;

import com.databricks.preserver.PreserverException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A batch-level failure with optional per-part errors.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * BatchError error = BatchError.of(new IOException("write failed"), batch);
 * for (int i = 0; i < batch.size(); i++) {
 *     if (!write(batch.get(i))) {
 *         error.failed(i, new IOException("rejected"));
 *     }
 * }
 * delivery.ack().acknowledge(scope, error);
 * }</pre>
 *
 * <p>Building an error is not thread-safe; finish recording part failures before acknowledging.
 */
public class BatchError extends PreserverException implements WalkableError {

  private final MessageBatch batch;
  private final Map<Integer, Throwable> partErrors = new HashMap<>();

  private BatchError(Throwable cause, MessageBatch batch) {
    super(cause.getMessage(), cause);
    this.batch = batch;
  }

  /**
   * Creates an error for a batch with no part-level errors recorded yet.
   *
   * @param cause The overall failure
   * @param batch The batch that was being processed
   * @return A new error
   */
  @Nonnull
  public static BatchError of(@Nonnull Throwable cause, @Nonnull MessageBatch batch) {
    return new BatchError(
        Objects.requireNonNull(cause, "cause cannot be null"),
        Objects.requireNonNull(batch, "batch cannot be null"));
  }

  /**
   * Records that the part at an index failed.
   *
   * @param index Position of the part in the processed batch
   * @param error The part's error
   * @return this error for method chaining
   * @throws IndexOutOfBoundsException if the index is outside the batch
   */
  @Nonnull
  public BatchError failed(int index, @Nonnull Throwable error) {
    if (index < 0 || index >= batch.size()) {
      throw new IndexOutOfBoundsException(
          "index " + index + " outside batch of size " + batch.size());
    }
    partErrors.put(index, Objects.requireNonNull(error, "error cannot be null"));
    return this;
  }

  /** Returns the batch that was being processed. */
  @Nonnull
  public MessageBatch batch() {
    return batch;
  }

  /**
   * Returns the error recorded for a part.
   *
   * @param index Position of the part in the processed batch
   * @return The error, or null if the part has none
   */
  @Nullable public Throwable partError(int index) {
    return partErrors.get(index);
  }

  @Override
  public int indexedErrors() {
    return partErrors.size();
  }

  @Override
  public void walkParts(@Nonnull WalkableError.PartVisitor visitor) {
    for (int i = 0; i < batch.size(); i++) {
      if (!visitor.visit(i, batch.get(i), partErrors.get(i))) {
        return;
      }
    }
  }
}
