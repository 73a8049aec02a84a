package com.databricks.preserver.input;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.databricks.preserver.AckFunction;
import com.databricks.preserver.AsyncSource;
import com.databricks.preserver.CancellationScope;
import com.databricks.preserver.Delivery;
import com.databricks.preserver.DrainTimeoutException;
import com.databricks.preserver.MockAsyncSource;
import com.databricks.preserver.PreserverException;
import com.databricks.preserver.PreserverOptions;
import com.databricks.preserver.ReadCancelledException;
import com.databricks.preserver.SourceClosedException;
import com.databricks.preserver.message.BatchError;
import com.databricks.preserver.message.MessageBatch;
import com.databricks.preserver.message.Part;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Tests for AsyncPreserver against an in-memory source. */
@Timeout(10)
public class AsyncPreserverTest {

  private MockAsyncSource source;
  private AsyncPreserver preserver;
  private CancellationScope scope;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    source = new MockAsyncSource();
    preserver = new AsyncPreserver(source);
    scope = CancellationScope.background();
    preserver.connect(scope);
    executor = Executors.newCachedThreadPool();
  }

  @AfterEach
  void tearDown() {
    scope.cancel();
    executor.shutdownNow();
  }

  private static List<String> payloads(MessageBatch batch) {
    List<String> result = new ArrayList<>();
    for (Part part : batch) {
      result.add(part.asString());
    }
    return result;
  }

  private Future<Delivery> readInBackground() {
    return executor.submit(() -> preserver.readBatch(scope));
  }

  private static Throwable failureOf(Future<?> future) throws InterruptedException {
    ExecutionException thrown =
        assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
    return thrown.getCause();
  }

  // ==================== Fresh reads ====================

  @Test
  void testFreshReadAndSuccessForwarded() {
    source.injectBatch("a", "b");

    Delivery delivery = preserver.readBatch(scope);
    assertEquals(List.of("a", "b"), payloads(delivery.batch()));
    assertEquals(1, preserver.stats().getPendingBatches());

    delivery.ack().acknowledge(scope, null);

    assertEquals(1, source.getAcknowledged().size());
    assertEquals(0, preserver.stats().getPendingBatches());
    assertTrue(source.getAckErrors().isEmpty());
  }

  @Test
  void testDeliveredBatchIsShallowCopy() {
    MessageBatch original = MessageBatch.ofStrings("a");
    source.injectBatch(original);

    Delivery delivery = preserver.readBatch(scope);

    assertNotSame(original, delivery.batch());
    assertNotSame(original.get(0), delivery.batch().get(0));
    assertSame(original.get(0).asBytes(), delivery.batch().get(0).asBytes());

    delivery.batch().get(0).setMetadata("processed", "true");
    assertNull(original.get(0).getMetadata("processed"));
  }

  @Test
  void testCallerTimeoutCancelsFreshRead() {
    CancellationScope timeout = scope.withTimeout(Duration.ofMillis(50));

    ReadCancelledException thrown =
        assertThrows(ReadCancelledException.class, () -> preserver.readBatch(timeout));
    assertEquals(CancellationScope.Reason.DEADLINE_EXCEEDED, thrown.getReason());
  }

  @Test
  void testConnectionErrorSurfacedVerbatim() {
    PreserverException error = new PreserverException("connection refused");
    source.failConnect(error);

    PreserverException thrown =
        assertThrows(PreserverException.class, () -> preserver.connect(scope));
    assertSame(error, thrown);
  }

  // ==================== Resending ====================

  @Test
  void testFailedBatchResentBeforeFreshData() {
    source.injectBatch("a");
    source.injectBatch("b");

    Delivery first = preserver.readBatch(scope);
    first.ack().acknowledge(scope, new IOException("processing failed"));

    Delivery resent = preserver.readBatch(scope);
    assertEquals(List.of("a"), payloads(resent.batch()));
    resent.ack().acknowledge(scope, null);

    Delivery fresh = preserver.readBatch(scope);
    assertEquals(List.of("b"), payloads(fresh.batch()));

    assertEquals(1, source.getAcknowledged().size());
    assertTrue(source.getAckErrors().isEmpty());
    assertEquals(1, preserver.stats().getTotalResends());
  }

  @Test
  void testFullyFailedBatchResentIdentically() {
    source.injectBatch("a", "b", "c");

    Delivery first = preserver.readBatch(scope);
    first.ack().acknowledge(scope, new IOException("sink unavailable"));

    Delivery resent = preserver.readBatch(scope);
    assertEquals(List.of("a", "b", "c"), payloads(resent.batch()));
  }

  @Test
  void testPartialFailureResendsOnlyFailedParts() {
    MessageBatch original = MessageBatch.ofStrings("a", "b", "c");
    source.injectBatch(original);

    Delivery first = preserver.readBatch(scope);
    first
        .ack()
        .acknowledge(
            scope,
            BatchError.of(new IOException("write failed"), first.batch())
                .failed(1, new IOException("rejected")));

    Delivery resent = preserver.readBatch(scope);
    assertEquals(List.of("b"), payloads(resent.batch()));
    resent.ack().acknowledge(scope, null);

    List<MessageBatch> acknowledged = source.getAcknowledged();
    assertEquals(1, acknowledged.size());
    assertSame(original, acknowledged.get(0));
    assertEquals(0, preserver.stats().getPendingBatches());
  }

  @Test
  void testFailedPartTracedAfterReordering() {
    source.injectBatch("a", "b", "c");

    Delivery first = preserver.readBatch(scope);
    List<Part> processed = new ArrayList<>(first.batch().parts());
    Collections.reverse(processed);
    MessageBatch reordered = MessageBatch.of(processed);
    first
        .ack()
        .acknowledge(
            scope,
            BatchError.of(new IOException("write failed"), reordered)
                .failed(0, new IOException("c rejected")));

    assertEquals(List.of("c"), payloads(preserver.readBatch(scope).batch()));
  }

  @Test
  void testUntraceablePartResendsWholeBatch() {
    source.injectBatch("a", "b", "c");

    Delivery first = preserver.readBatch(scope);
    MessageBatch processed = MessageBatch.of(first.batch().get(0), Part.of("derived"));
    first
        .ack()
        .acknowledge(
            scope,
            BatchError.of(new IOException("write failed"), processed)
                .failed(1, new IOException("rejected")));

    assertEquals(List.of("a", "b", "c"), payloads(preserver.readBatch(scope).batch()));
  }

  @Test
  void testResendsServedInFailureOrder() {
    source.injectBatch("a");
    source.injectBatch("b");
    source.injectBatch("c");
    Delivery a = preserver.readBatch(scope);
    Delivery b = preserver.readBatch(scope);
    Delivery c = preserver.readBatch(scope);

    c.ack().acknowledge(scope, new IOException("x"));
    a.ack().acknowledge(scope, new IOException("x"));
    b.ack().acknowledge(scope, new IOException("x"));

    assertEquals(List.of("c"), payloads(preserver.readBatch(scope).batch()));
    assertEquals(List.of("a"), payloads(preserver.readBatch(scope).batch()));
    assertEquals(List.of("b"), payloads(preserver.readBatch(scope).batch()));
  }

  @Test
  void testRepeatedAcknowledgmentIgnored() {
    source.injectBatch("a");

    Delivery delivery = preserver.readBatch(scope);
    delivery.ack().acknowledge(scope, null);
    delivery.ack().acknowledge(scope, new IOException("late failure"));

    assertEquals(0, preserver.stats().getQueuedResends());
    assertEquals(1, source.getAcknowledged().size());
    assertEquals(0, preserver.stats().getPendingBatches());
  }

  @Test
  void testConcurrentFailuresAllResentOnce() throws Exception {
    int count = 8;
    for (int i = 0; i < count; i++) {
      source.injectBatch("msg-" + i);
    }
    List<Delivery> deliveries = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      deliveries.add(preserver.readBatch(scope));
    }

    CountDownLatch start = new CountDownLatch(1);
    CountDownLatch finished = new CountDownLatch(count);
    for (Delivery delivery : deliveries) {
      executor.submit(
          () -> {
            start.await();
            delivery.ack().acknowledge(scope, new IOException("failed"));
            finished.countDown();
            return null;
          });
    }
    start.countDown();
    assertTrue(finished.await(5, TimeUnit.SECONDS));

    Set<String> resent = new HashSet<>();
    for (int i = 0; i < count; i++) {
      Delivery delivery = preserver.readBatch(scope);
      assertTrue(resent.add(delivery.batch().get(0).asString()), "Batch resent twice");
      delivery.ack().acknowledge(scope, null);
    }

    assertEquals(count, resent.size());
    assertEquals(count, source.getAcknowledged().size());
    assertEquals(0, preserver.stats().getQueuedResends());
    assertEquals(count, preserver.stats().getTotalResends());
  }

  // ==================== Read interruption ====================

  @Test
  void testFailureInterruptsBlockedFreshRead() throws Exception {
    source.injectBatch("a");
    Delivery first = preserver.readBatch(scope);

    Future<Delivery> blocked = readInBackground();
    Thread.sleep(50);
    assertFalse(blocked.isDone(), "Read should block on the empty source");

    first.ack().acknowledge(scope, new IOException("processing failed"));

    assertTrue(failureOf(blocked) instanceof ReadCancelledException);
    assertEquals(List.of("a"), payloads(preserver.readBatch(scope).batch()));
  }

  // ==================== Backoff ====================

  @Test
  void testBackoffAppliedAfterRepeatedFailures() {
    preserver =
        new AsyncPreserver(
            source,
            PreserverOptions.builder().setInitialBackoffMs(200).setMaxBackoffMs(1000).build());
    source.injectBatch("a");

    Delivery delivery = preserver.readBatch(scope);
    for (int attempt = 1; attempt <= 2; attempt++) {
      delivery.ack().acknowledge(scope, new IOException("failed"));
      long start = System.nanoTime();
      delivery = preserver.readBatch(scope);
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
      assertTrue(elapsedMs < 150, "Attempt " + attempt + " should not back off: " + elapsedMs);
    }

    delivery.ack().acknowledge(scope, new IOException("failed"));
    long start = System.nanoTime();
    delivery = preserver.readBatch(scope);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(elapsedMs >= 190, "Third attempt should back off: " + elapsedMs);
    assertEquals(List.of("a"), payloads(delivery.batch()));
  }

  @Test
  void testCancelledBackoffKeepsBatchQueued() {
    preserver =
        new AsyncPreserver(
            source,
            PreserverOptions.builder()
                .setInitialBackoffMs(300)
                .setMaxBackoffMs(300)
                .setBackoffAfterAttempts(0)
                .build());
    source.injectBatch("a");

    preserver.readBatch(scope).ack().acknowledge(scope, new IOException("failed"));
    CancellationScope timeout = scope.withTimeout(Duration.ofMillis(50));

    assertThrows(ReadCancelledException.class, () -> preserver.readBatch(timeout));
    assertEquals(1, preserver.stats().getQueuedResends());

    Delivery resent = preserver.readBatch(scope);
    assertEquals(List.of("a"), payloads(resent.batch()));
    assertEquals(0, preserver.stats().getQueuedResends());
  }

  // ==================== Draining ====================

  @Test
  void testCloseHeldUntilPendingBatchesAcknowledged() throws Exception {
    source.injectBatch("a");
    source.injectBatch("b");
    Delivery a = preserver.readBatch(scope);
    Delivery b = preserver.readBatch(scope);
    source.closeStream();

    preserver.connect(scope);
    assertTrue(preserver.stats().isSourceClosed());

    Future<Delivery> draining = readInBackground();
    a.ack().acknowledge(scope, null);
    Thread.sleep(50);
    assertFalse(draining.isDone(), "One batch is still pending");

    b.ack().acknowledge(scope, null);

    assertTrue(failureOf(draining) instanceof SourceClosedException);
    assertEquals(2, source.getAcknowledged().size());
  }

  @Test
  void testDrainTimeout() {
    source.injectBatch("a");
    source.injectBatch("b");
    preserver.readBatch(scope);
    preserver.readBatch(scope);
    source.closeStream();
    preserver.connect(scope);

    DrainTimeoutException thrown =
        assertThrows(
            DrainTimeoutException.class,
            () -> preserver.readBatch(scope.withTimeout(Duration.ofMillis(100))));
    assertEquals(2, thrown.getPendingBatches());
  }

  @Test
  void testClosedWithNothingPending() {
    source.closeStream();

    assertThrows(SourceClosedException.class, () -> preserver.connect(scope));
    assertThrows(SourceClosedException.class, () -> preserver.readBatch(scope));
  }

  @Test
  void testResendsServedWhileDraining() {
    source.injectBatch("a");
    source.injectBatch("b");
    Delivery a = preserver.readBatch(scope);
    Delivery b = preserver.readBatch(scope);
    source.closeStream();
    preserver.connect(scope);

    a.ack().acknowledge(scope, new IOException("failed"));
    Delivery resent = preserver.readBatch(scope);
    assertEquals(List.of("a"), payloads(resent.batch()));

    resent.ack().acknowledge(scope, null);
    b.ack().acknowledge(scope, null);

    assertThrows(SourceClosedException.class, () -> preserver.readBatch(scope));
  }

  @Test
  void testCloseReportedByReadWaitsForAcknowledgment() throws Exception {
    source.injectBatch("a");
    Delivery a = preserver.readBatch(scope);
    source.closeStream();

    Future<Delivery> draining = readInBackground();
    Thread.sleep(50);
    assertFalse(draining.isDone());

    a.ack().acknowledge(scope, null);

    assertTrue(failureOf(draining) instanceof SourceClosedException);
  }

  @Test
  void testResendInterruptsDrain() throws Exception {
    source.injectBatch("a");
    source.injectBatch("b");
    Delivery a = preserver.readBatch(scope);
    Delivery b = preserver.readBatch(scope);
    source.closeStream();
    preserver.connect(scope);

    Future<Delivery> draining = readInBackground();
    Thread.sleep(50);
    a.ack().acknowledge(scope, new IOException("failed"));

    assertTrue(failureOf(draining) instanceof ReadCancelledException);

    Delivery resent = preserver.readBatch(scope);
    assertEquals(List.of("a"), payloads(resent.batch()));
    resent.ack().acknowledge(scope, null);
    b.ack().acknowledge(scope, null);

    assertThrows(SourceClosedException.class, () -> preserver.readBatch(scope));
  }

  // ==================== Delegation ====================

  @Test
  void testCloseDelegatesToSource() {
    AsyncSource mockSource = mock(AsyncSource.class);
    AsyncPreserver wrapped = new AsyncPreserver(mockSource);

    wrapped.close(scope);

    verify(mockSource).close(scope);
  }

  @Test
  void testSourceAckInvokedOnceAfterResends() {
    AsyncSource mockSource = mock(AsyncSource.class);
    AckFunction sourceAck = mock(AckFunction.class);
    when(mockSource.readBatch(any()))
        .thenReturn(Delivery.of(MessageBatch.ofStrings("a", "b"), sourceAck));
    AsyncPreserver wrapped = new AsyncPreserver(mockSource);

    Delivery delivery = wrapped.readBatch(scope);
    delivery.ack().acknowledge(scope, new IOException("failed"));
    delivery = wrapped.readBatch(scope);
    delivery.ack().acknowledge(scope, new IOException("failed again"));
    delivery = wrapped.readBatch(scope);
    delivery.ack().acknowledge(scope, null);

    verify(mockSource, times(1)).readBatch(any());
    verify(sourceAck, times(1)).acknowledge(scope, null);
    verifyNoMoreInteractions(sourceAck);
  }

  @Test
  void testSourceAckFailurePropagates() {
    AsyncSource mockSource = mock(AsyncSource.class);
    AckFunction sourceAck = mock(AckFunction.class);
    PreserverException commitError = new PreserverException("commit failed");
    doThrow(commitError).when(sourceAck).acknowledge(any(), any());
    when(mockSource.readBatch(any()))
        .thenReturn(Delivery.of(MessageBatch.ofStrings("a"), sourceAck));
    AsyncPreserver wrapped = new AsyncPreserver(mockSource);

    Delivery delivery = wrapped.readBatch(scope);

    PreserverException thrown =
        assertThrows(PreserverException.class, () -> delivery.ack().acknowledge(scope, null));
    assertSame(commitError, thrown);
  }
}
