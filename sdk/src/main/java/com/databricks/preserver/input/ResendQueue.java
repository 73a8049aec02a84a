package com.databricks.preserver.input;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;

/**
 * FIFO of failed batches waiting to be delivered again.
 *
 * <p>This class provides thread-safe coordination between:
 *
 * <ul>
 *   <li>Acknowledging threads calling {@link #push} when a delivered batch fails
 *   <li>The reader thread calling {@link #pollOrArm} before every read
 * </ul>
 *
 * <p>The queue also holds the interrupt of the fresh read in progress. Both are guarded by the same
 * lock, so a push either lands before the reader checks the queue, or triggers the interrupt the
 * reader installed and wakes the blocked read.
 */
final class ResendQueue {

  private static final Runnable NO_INTERRUPT = () -> {};

  private final Deque<ResendEntry> entries = new ArrayDeque<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicLong totalPushed = new AtomicLong();

  private Runnable interrupt = NO_INTERRUPT;

  /**
   * Appends a failed batch and wakes the fresh read in progress, if any.
   *
   * @param entry The entry to resend
   */
  void push(ResendEntry entry) {
    lock.lock();
    try {
      entries.addLast(entry);
      totalPushed.incrementAndGet();
      interrupt.run();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Puts back an entry whose redelivery was abandoned, so that it is served next.
   *
   * @param entry The entry taken by the last {@link #pollOrArm}
   */
  void pushFront(ResendEntry entry) {
    lock.lock();
    try {
      entries.addFirst(entry);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Takes the oldest queued entry, or installs the interrupt for the fresh read about to start.
   *
   * @param freshReadInterrupt Action that wakes the fresh read if an entry is pushed while it runs
   * @return The oldest entry, or null if the queue is empty and the interrupt was installed
   */
  @Nullable ResendEntry pollOrArm(Runnable freshReadInterrupt) {
    lock.lock();
    try {
      ResendEntry entry = entries.pollFirst();
      if (entry == null) {
        interrupt = freshReadInterrupt;
      }
      return entry;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the number of queued entries. */
  int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /** Returns how many entries have ever been pushed, redelivery failures included. */
  long totalPushed() {
    return totalPushed.get();
  }
}
