package com.databricks.preserver.input;

/**
 * Point-in-time diagnostics of an {@link AsyncPreserver}.
 *
 * <p>Retries are unbounded, so a batch that can never be processed stays in the resend queue
 * forever. These counters are meant for monitoring that situation. The values are read without a
 * common lock and may be slightly inconsistent with each other.
 */
public final class PreserverStats {

  private final long pendingBatches;
  private final int queuedResends;
  private final long totalResends;
  private final boolean sourceClosed;

  PreserverStats(long pendingBatches, int queuedResends, long totalResends, boolean sourceClosed) {
    this.pendingBatches = pendingBatches;
    this.queuedResends = queuedResends;
    this.totalResends = totalResends;
    this.sourceClosed = sourceClosed;
  }

  /** Returns the number of batches read from the source and not yet successfully acknowledged. */
  public long getPendingBatches() {
    return pendingBatches;
  }

  /** Returns the number of failed batches waiting to be delivered again. */
  public int getQueuedResends() {
    return queuedResends;
  }

  /** Returns how many times a delivered batch has failed and been queued for resending. */
  public long getTotalResends() {
    return totalResends;
  }

  /** Returns true once the source has closed while batches were still pending. */
  public boolean isSourceClosed() {
    return sourceClosed;
  }

  @Override
  public String toString() {
    return "PreserverStats{pendingBatches="
        + pendingBatches
        + ", queuedResends="
        + queuedResends
        + ", totalResends="
        + totalResends
        + ", sourceClosed="
        + sourceClosed
        + "}";
  }
}
