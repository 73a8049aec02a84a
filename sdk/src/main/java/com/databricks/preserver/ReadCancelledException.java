package com.databricks.preserver;

import javax.annotation.Nullable;

/**
 * Signals that a blocking read was cancelled before it produced a batch.
 *
 * <p>This happens when the caller's {@link CancellationScope} ends, when the reading thread is
 * interrupted, or when a fresh read is woken early because a previously delivered batch failed and
 * is waiting to be resent. In every case the caller is expected to issue another read.
 */
public class ReadCancelledException extends PreserverException {

  @Nullable private final CancellationScope.Reason reason;

  /**
   * Constructs a new ReadCancelledException.
   *
   * @param message the detail message
   * @param reason why the scope ended, or null if the read was interrupted by other means
   */
  public ReadCancelledException(String message, @Nullable CancellationScope.Reason reason) {
    super(message);
    this.reason = reason;
  }

  /**
   * Constructs a new ReadCancelledException caused by a thread interrupt.
   *
   * @param message the detail message
   * @param cause the interrupt
   */
  public ReadCancelledException(String message, InterruptedException cause) {
    super(message, cause);
    this.reason = null;
  }

  /** Returns why the scope ended, or null if it did not end through a scope. */
  @Nullable public CancellationScope.Reason getReason() {
    return reason;
  }
}
