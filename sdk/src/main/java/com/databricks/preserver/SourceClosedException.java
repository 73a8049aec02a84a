package com.databricks.preserver;

/**
 * Signals that a source has reached end-of-stream.
 *
 * <p>Sources throw this from {@link AsyncSource#connect} or {@link AsyncSource#readBatch} once they
 * have no more data. The {@link com.databricks.preserver.input.AsyncPreserver} holds the signal back
 * while delivered batches are still unacknowledged and only passes it on once they are resolved.
 */
public class SourceClosedException extends PreserverException {

  /**
   * Constructs a new SourceClosedException with the specified detail message.
   *
   * @param message the detail message
   */
  public SourceClosedException(String message) {
    super(message);
  }

  /**
   * Constructs a new SourceClosedException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public SourceClosedException(String message, Throwable cause) {
    super(message, cause);
  }
}
