package com.databricks.preserver;

import javax.annotation.Nonnull;

/**
 * An asynchronous source of message batches.
 *
 * <p>This is the contract both consumed from a wrapped source and exposed by {@link
 * com.databricks.preserver.input.AsyncPreserver}, so a preserver can be used wherever the source it
 * wraps was used.
 *
 * <p>{@link #readBatch} is called by one reader at a time. The {@link AckFunction} of each delivery
 * may be invoked later from any thread.
 *
 * <p>All errors are unchecked. Connection problems are reported with whatever exception the
 * implementation chooses; end-of-stream must be reported with {@link SourceClosedException} and a
 * read ended by its scope with {@link ReadCancelledException}.
 */
public interface AsyncSource {

  /**
   * Establishes the connection to the source, if one is needed.
   *
   * @param scope Scope bounding the attempt
   * @throws SourceClosedException if the source has no more data
   */
  void connect(@Nonnull CancellationScope scope);

  /**
   * Reads the next batch, blocking until data is available, the source closes, or the scope ends.
   *
   * @param scope Scope bounding the read
   * @return The next batch and its acknowledgment callback
   * @throws SourceClosedException if the source has no more data
   * @throws ReadCancelledException if the scope ended before a batch was read
   */
  @Nonnull
  Delivery readBatch(@Nonnull CancellationScope scope);

  /**
   * Shuts the source down, blocking until completion or the end of the scope.
   *
   * @param scope Scope bounding the shutdown
   */
  void close(@Nonnull CancellationScope scope);
}
