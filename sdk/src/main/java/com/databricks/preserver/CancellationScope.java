package com.databricks.preserver;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A cancellable scope bounding the lifetime of blocking operations.
 *
 * <p>Scopes form a tree. A scope ends exactly once, either because {@link #cancel()} was called or
 * because its deadline passed, and ending a scope ends all of its live children. Ending is safe to
 * trigger from any thread and further calls are no-ops.
 *
 * <p>Blocking operations that accept a scope must return promptly once it ends:
 *
 * <pre>{@code
 * CancellationScope scope = CancellationScope.background().withTimeout(Duration.ofSeconds(5));
 * try {
 *     Delivery delivery = source.readBatch(scope);
 * } finally {
 *     scope.cancel();
 * }
 * }</pre>
 *
 * <p>Children unregister from their parent when they end, so a long-lived parent does not
 * accumulate scopes that were cancelled after use.
 */
public final class CancellationScope {

  /** Why a scope ended. */
  public enum Reason {
    /** {@link #cancel()} was called on the scope or one of its ancestors. */
    CANCELLED,

    /** The deadline of the scope or one of its ancestors passed. */
    DEADLINE_EXCEEDED
  }

  private static final ScheduledExecutorService DEADLINES =
      Executors.newSingleThreadScheduledExecutor(
          runnable -> {
            Thread thread = new Thread(runnable, "preserver-scope-deadlines");
            thread.setDaemon(true);
            return thread;
          });

  @Nullable private final CancellationScope parent;
  private final CompletableFuture<Void> done = new CompletableFuture<>();
  private final Set<CancellationScope> children = ConcurrentHashMap.newKeySet();
  private volatile Reason reason;
  private volatile ScheduledFuture<?> deadline;

  private CancellationScope(@Nullable CancellationScope parent) {
    this.parent = parent;
  }

  /**
   * Returns a new root scope that only ends when cancelled.
   *
   * @return A new root scope
   */
  @Nonnull
  public static CancellationScope background() {
    return new CancellationScope(null);
  }

  /**
   * Creates a child scope that ends when this scope ends or when it is cancelled itself.
   *
   * @return A new child scope, already ended if this scope has ended
   */
  @Nonnull
  public CancellationScope child() {
    CancellationScope child = new CancellationScope(this);
    children.add(child);
    // Ended between the check and the registration: propagate by hand.
    Reason ended = reason;
    if (ended != null) {
      child.end(ended);
    }
    return child;
  }

  /**
   * Creates a child scope that additionally ends once the timeout elapses.
   *
   * @param timeout How long the child may live
   * @return A new child scope
   */
  @Nonnull
  public CancellationScope withTimeout(@Nonnull Duration timeout) {
    CancellationScope child = child();
    if (timeout.isZero() || timeout.isNegative()) {
      child.end(Reason.DEADLINE_EXCEEDED);
      return child;
    }
    child.deadline =
        DEADLINES.schedule(
            () -> child.end(Reason.DEADLINE_EXCEEDED), timeout.toNanos(), TimeUnit.NANOSECONDS);
    if (child.isDone()) {
      child.deadline.cancel(false);
    }
    return child;
  }

  /** Ends this scope and all of its children. Idempotent. */
  public void cancel() {
    end(Reason.CANCELLED);
  }

  /** Returns true once this scope has ended. */
  public boolean isDone() {
    return done.isDone();
  }

  /** Returns why this scope ended, or null while it is still active. */
  @Nullable public Reason reason() {
    return reason;
  }

  /**
   * Registers an action to run once this scope ends.
   *
   * <p>If the scope has already ended the action runs immediately on the calling thread.
   *
   * @param action The action to run
   */
  public void onDone(@Nonnull Runnable action) {
    done.thenRun(action);
  }

  /**
   * Throws if this scope has ended.
   *
   * @throws ReadCancelledException if the scope has ended
   */
  public void checkActive() {
    Reason ended = reason;
    if (ended != null) {
      throw new ReadCancelledException("Scope ended: " + ended, ended);
    }
  }

  /**
   * Blocks until this scope ends or the timeout elapses, whichever comes first.
   *
   * @param timeout Maximum time to wait
   * @param unit Time unit for the timeout
   * @return true if the scope ended, false if the full timeout elapsed
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean await(long timeout, @Nonnull TimeUnit unit) throws InterruptedException {
    if (timeout <= 0) {
      return isDone();
    }
    try {
      done.get(timeout, unit);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (ExecutionException e) {
      // The future is only ever completed normally.
      throw new IllegalStateException("Scope completed exceptionally", e);
    }
  }

  /**
   * Blocks until the future completes or this scope ends, whichever comes first.
   *
   * <p>Intended for source implementations that hand work to another thread and need their read to
   * honour cancellation.
   *
   * @param future The result to wait for
   * @param <T> The result type
   * @return The result of the future
   * @throws ReadCancelledException if the scope ends before the future completes
   * @throws InterruptedException if the calling thread is interrupted while waiting
   * @throws ExecutionException if the future completes exceptionally
   */
  public <T> T await(@Nonnull CompletableFuture<T> future)
      throws InterruptedException, ExecutionException {
    CompletableFuture.anyOf(future, done).get();
    if (future.isDone()) {
      return future.get();
    }
    checkActive();
    throw new IllegalStateException("Scope wait returned before completion");
  }

  private void end(Reason why) {
    synchronized (this) {
      if (reason != null) {
        return;
      }
      reason = why;
    }
    ScheduledFuture<?> pending = deadline;
    if (pending != null) {
      pending.cancel(false);
    }
    if (parent != null) {
      parent.children.remove(this);
    }
    done.complete(null);
    for (CancellationScope child : children) {
      child.end(why);
    }
    children.clear();
  }
}
