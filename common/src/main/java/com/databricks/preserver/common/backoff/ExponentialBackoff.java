package com.databricks.preserver.common.backoff;

import java.time.Duration;
import javax.annotation.Nonnull;

/**
 * Exponential backoff policy with a floor, a ceiling and a growth factor.
 *
 * <p>The policy itself is immutable and can be shared. Callers obtain a {@link Sequence} per retried
 * item via {@link #start()}; each sequence keeps its own state so that unrelated items do not
 * influence each other's pacing.
 *
 * <p>There is no limit on the total elapsed time: a sequence never stops producing delays. Once the
 * ceiling is reached every further delay equals the ceiling.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ExponentialBackoff policy = new ExponentialBackoff(Duration.ofMillis(1), Duration.ofSeconds(1), 1.1);
 * ExponentialBackoff.Sequence backoff = policy.start();
 * Thread.sleep(backoff.next().toMillis()); // 1ms
 * Thread.sleep(backoff.next().toMillis()); // 1.1ms
 * }</pre>
 */
public final class ExponentialBackoff {

  public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofMillis(1);
  public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(1);
  public static final double DEFAULT_MULTIPLIER = 1.1;

  private final long initialIntervalNanos;
  private final long maxIntervalNanos;
  private final double multiplier;

  /** Creates a policy with the default interval of 1ms growing by 1.1 up to 1s. */
  public ExponentialBackoff() {
    this(DEFAULT_INITIAL_INTERVAL, DEFAULT_MAX_INTERVAL, DEFAULT_MULTIPLIER);
  }

  /**
   * Creates a policy with custom settings.
   *
   * @param initialInterval The first delay produced by a sequence
   * @param maxInterval The ceiling applied to every delay
   * @param multiplier The factor applied to the delay after each step, at least 1.0
   * @throws IllegalArgumentException if an interval is negative, the ceiling is below the floor, or
   *     the multiplier is below 1.0
   */
  public ExponentialBackoff(
      @Nonnull Duration initialInterval, @Nonnull Duration maxInterval, double multiplier) {
    if (initialInterval.isNegative()) {
      throw new IllegalArgumentException("initialInterval must not be negative");
    }
    if (maxInterval.compareTo(initialInterval) < 0) {
      throw new IllegalArgumentException("maxInterval must not be smaller than initialInterval");
    }
    if (Double.isNaN(multiplier) || multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be at least 1.0, got " + multiplier);
    }
    this.initialIntervalNanos = initialInterval.toNanos();
    this.maxIntervalNanos = maxInterval.toNanos();
    this.multiplier = multiplier;
  }

  /** Returns the first delay of every sequence. */
  public Duration initialInterval() {
    return Duration.ofNanos(initialIntervalNanos);
  }

  /** Returns the largest delay a sequence produces. */
  public Duration maxInterval() {
    return Duration.ofNanos(maxIntervalNanos);
  }

  /** Returns the growth factor between consecutive delays. */
  public double multiplier() {
    return multiplier;
  }

  /**
   * Starts a new, independent sequence of delays.
   *
   * @return A sequence positioned at the initial interval
   */
  @Nonnull
  public Sequence start() {
    return new Sequence();
  }

  /**
   * Stateful view over the policy for a single retried item.
   *
   * <p>Not thread-safe: a sequence belongs to the one item it paces.
   */
  public final class Sequence {
    private double currentNanos = initialIntervalNanos;
    private int steps = 0;

    private Sequence() {}

    /**
     * Returns the next delay and advances the sequence.
     *
     * @return The delay to wait before the next attempt, never longer than the ceiling
     */
    @Nonnull
    public Duration next() {
      long delay = (long) Math.min(currentNanos, maxIntervalNanos);
      // Stop growing once at the ceiling so the double never overflows.
      if (currentNanos < maxIntervalNanos) {
        currentNanos = Math.min(currentNanos * multiplier, maxIntervalNanos);
      }
      steps++;
      return Duration.ofNanos(delay);
    }

    /** Returns how many delays this sequence has produced. */
    public int steps() {
      return steps;
    }

    /** Rewinds the sequence to the initial interval. */
    public void reset() {
      currentNanos = initialIntervalNanos;
      steps = 0;
    }
  }
}
