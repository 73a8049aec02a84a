package com.databricks.preserver.message;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A batch processing failure that records which individual parts failed.
 *
 * <p>Acknowledging a multi-part batch with an error implementing this interface lets the preserver
 * resend only the failed parts instead of the whole batch.
 *
 * @see BatchError
 */
public interface WalkableError {

  /** Returns the number of parts that have an individual error. */
  int indexedErrors();

  /**
   * Visits every part of the processed batch in order.
   *
   * @param visitor Called with each part and its error, if any; returning false stops the walk
   */
  void walkParts(@Nonnull PartVisitor visitor);

  /** Callback for {@link #walkParts}. */
  @FunctionalInterface
  interface PartVisitor {

    /**
     * Visits one part.
     *
     * @param index Position of the part in the processed batch
     * @param part The part
     * @param error The part's error, or null if it was processed successfully
     * @return true to continue, false to stop walking
     */
    boolean visit(int index, @Nonnull Part part, @Nullable Throwable error);
  }
}
