package com.databricks.preserver;

/**
 * Signals that the caller's scope ended while waiting for in-flight batches to be acknowledged
 * after the source closed.
 *
 * <p>Distinct from {@link ReadCancelledException} so that callers can tell "gave up waiting for
 * acknowledgments" apart from "the read itself was cancelled". Not retried internally.
 */
public class DrainTimeoutException extends PreserverException {

  private final long pendingBatches;

  /**
   * Constructs a new DrainTimeoutException.
   *
   * @param message the detail message
   * @param pendingBatches the number of batches still unacknowledged when the wait ended
   */
  public DrainTimeoutException(String message, long pendingBatches) {
    super(message);
    this.pendingBatches = pendingBatches;
  }

  /** Returns the number of batches that were still unacknowledged when the wait ended. */
  public long getPendingBatches() {
    return pendingBatches;
  }
}
