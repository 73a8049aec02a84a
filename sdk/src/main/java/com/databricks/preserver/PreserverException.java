package com.databricks.preserver;

/**
 * Base exception class for all Preserver SDK errors.
 *
 * <p>This is an unchecked exception (extends {@link RuntimeException}). Callers can catch this
 * exception or let it propagate up the call stack.
 *
 * <p>Only infrastructure-level conditions are reported through this hierarchy:
 *
 * <ul>
 *   <li>{@link SourceClosedException} - the source reached end-of-stream and nothing is in flight
 *   <li>{@link DrainTimeoutException} - the caller gave up waiting for in-flight acknowledgments
 *   <li>{@link ReadCancelledException} - a blocking read or backoff sleep was cancelled
 * </ul>
 *
 * <p>A failed batch is never reported as an exception; it is delivered again instead.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try {
 *     Delivery delivery = preserver.readBatch(scope);
 *     process(delivery.batch());
 *     delivery.ack().acknowledge(scope, null);
 * } catch (SourceClosedException e) {
 *     // Nothing left to read and everything has been acknowledged
 *     break;
 * } catch (ReadCancelledException e) {
 *     // Read again to pick up queued resends
 *     continue;
 * }
 * }</pre>
 */
public class PreserverException extends RuntimeException {

  /**
   * Constructs a new PreserverException with the specified detail message.
   *
   * @param message the detail message
   */
  public PreserverException(String message) {
    super(message);
  }

  /**
   * Constructs a new PreserverException with the specified detail message and cause.
   *
   * @param message the detail message
   * @param cause the cause of the exception
   */
  public PreserverException(String message, Throwable cause) {
    super(message, cause);
  }
}
