package com.databricks.preserver;

import com.databricks.preserver.message.MessageBatch;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link AsyncSource} for tests.
 *
 * <p>Batches injected with {@link #injectBatch} are handed out in order. Reads block until a batch is
 * available, the source is closed, or the read scope ends. Every acknowledgment the source receives
 * is recorded.
 */
public class MockAsyncSource implements AsyncSource {

  private final LinkedBlockingQueue<MessageBatch> batches = new LinkedBlockingQueue<>();
  private final List<MessageBatch> acknowledged = Collections.synchronizedList(new ArrayList<>());
  private final List<Throwable> ackErrors = Collections.synchronizedList(new ArrayList<>());
  private final AtomicInteger reads = new AtomicInteger();
  private final AtomicInteger connects = new AtomicInteger();

  private volatile boolean closed = false;
  private volatile RuntimeException connectError;

  /** Queues a batch for reading. */
  public void injectBatch(MessageBatch batch) {
    batches.add(batch);
  }

  /** Queues a batch with one part per string. */
  public void injectBatch(String... payloads) {
    injectBatch(MessageBatch.ofStrings(payloads));
  }

  /** Marks end-of-stream; reads fail with {@link SourceClosedException} once drained. */
  public void closeStream() {
    closed = true;
  }

  /** Makes every following {@link #connect} throw the given error. */
  public void failConnect(RuntimeException error) {
    connectError = error;
  }

  @Override
  public void connect(CancellationScope scope) {
    connects.incrementAndGet();
    RuntimeException error = connectError;
    if (error != null) {
      throw error;
    }
    if (closed && batches.isEmpty()) {
      throw new SourceClosedException("mock source closed");
    }
  }

  @Override
  public Delivery readBatch(CancellationScope scope) {
    while (true) {
      scope.checkActive();
      MessageBatch batch;
      try {
        batch = batches.poll(1, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ReadCancelledException("mock read interrupted", e);
      }
      if (batch != null) {
        reads.incrementAndGet();
        return Delivery.of(
            batch,
            (ackScope, error) -> {
              if (error != null) {
                ackErrors.add(error);
              } else {
                acknowledged.add(batch);
              }
            });
      }
      if (closed) {
        throw new SourceClosedException("mock source closed");
      }
    }
  }

  @Override
  public void close(CancellationScope scope) {
    closed = true;
  }

  /** Returns the batches acknowledged successfully, in acknowledgment order. */
  public List<MessageBatch> getAcknowledged() {
    synchronized (acknowledged) {
      return new ArrayList<>(acknowledged);
    }
  }

  /** Returns errors the source was acknowledged with. */
  public List<Throwable> getAckErrors() {
    synchronized (ackErrors) {
      return new ArrayList<>(ackErrors);
    }
  }

  /** Returns how many batches have been read. */
  public int getReadCount() {
    return reads.get();
  }

  /** Returns how many times connect was called. */
  public int getConnectCount() {
    return connects.get();
  }

  public boolean isClosed() {
    return closed;
  }
}
