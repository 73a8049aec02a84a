package com.databricks.preserver;

import com.databricks.preserver.common.backoff.ExponentialBackoff;
import java.time.Duration;

/**
 * Configuration options for {@link com.databricks.preserver.input.AsyncPreserver}.
 *
 * <p>The defaults pace permanently failing batches from 1ms up to 1s between deliveries, growing by
 * a factor of 1.1, and poll for outstanding acknowledgments every 10ms once the source has closed.
 *
 * <p>Use the builder pattern to create instances:
 *
 * <pre>{@code
 * PreserverOptions options = PreserverOptions.builder()
 *     .setMaxBackoffMs(5000)
 *     .setDrainPollIntervalMs(50)
 *     .build();
 * }</pre>
 */
public class PreserverOptions {

  private long initialBackoffMs = 1;
  private long maxBackoffMs = 1000;
  private double backoffMultiplier = 1.1;
  private int backoffAfterAttempts = 2;
  private long drainPollIntervalMs = 10;

  private PreserverOptions() {}

  private PreserverOptions(
      long initialBackoffMs,
      long maxBackoffMs,
      double backoffMultiplier,
      int backoffAfterAttempts,
      long drainPollIntervalMs) {
    this.initialBackoffMs = initialBackoffMs;
    this.maxBackoffMs = maxBackoffMs;
    this.backoffMultiplier = backoffMultiplier;
    this.backoffAfterAttempts = backoffAfterAttempts;
    this.drainPollIntervalMs = drainPollIntervalMs;
  }

  /**
   * Returns the first delay applied to a batch that keeps failing.
   *
   * @return the initial backoff in milliseconds
   */
  public long initialBackoffMs() {
    return this.initialBackoffMs;
  }

  /**
   * Returns the ceiling on the delay between redeliveries of the same batch.
   *
   * @return the maximum backoff in milliseconds
   */
  public long maxBackoffMs() {
    return this.maxBackoffMs;
  }

  /**
   * Returns the factor applied to the delay after every delayed redelivery.
   *
   * @return the backoff multiplier
   */
  public double backoffMultiplier() {
    return this.backoffMultiplier;
  }

  /**
   * Returns how many redeliveries of a batch happen without any delay.
   *
   * <p>Redeliveries past this count wait for the next backoff delay first, which keeps permanently
   * failing batches from turning the read loop into a busy loop.
   *
   * @return the number of undelayed redeliveries
   */
  public int backoffAfterAttempts() {
    return this.backoffAfterAttempts;
  }

  /**
   * Returns how often outstanding acknowledgments are checked while draining a closed source.
   *
   * @return the drain poll interval in milliseconds
   */
  public long drainPollIntervalMs() {
    return this.drainPollIntervalMs;
  }

  /**
   * Returns the backoff policy described by these options.
   *
   * @return a new backoff policy
   */
  public ExponentialBackoff backoffPolicy() {
    return new ExponentialBackoff(
        Duration.ofMillis(initialBackoffMs), Duration.ofMillis(maxBackoffMs), backoffMultiplier);
  }

  /**
   * Returns the default options.
   *
   * <p>Default values: - initialBackoffMs: 1 - maxBackoffMs: 1000 - backoffMultiplier: 1.1 -
   * backoffAfterAttempts: 2 - drainPollIntervalMs: 10
   *
   * @return the default options
   */
  public static PreserverOptions getDefault() {
    return new PreserverOptions();
  }

  /**
   * Returns a new builder for creating PreserverOptions.
   *
   * @return a new PreserverOptionsBuilder
   */
  public static PreserverOptionsBuilder builder() {
    return new PreserverOptionsBuilder();
  }

  /**
   * Returns a builder initialized with this instance's values.
   *
   * @return a new builder pre-populated with this instance's values
   */
  public PreserverOptionsBuilder toBuilder() {
    return new PreserverOptionsBuilder()
        .setInitialBackoffMs(this.initialBackoffMs)
        .setMaxBackoffMs(this.maxBackoffMs)
        .setBackoffMultiplier(this.backoffMultiplier)
        .setBackoffAfterAttempts(this.backoffAfterAttempts)
        .setDrainPollIntervalMs(this.drainPollIntervalMs);
  }

  /**
   * Builder for creating PreserverOptions instances.
   *
   * <p>All parameters have defaults if not specified. Values are validated as they are set.
   *
   * @see PreserverOptions
   */
  public static class PreserverOptionsBuilder {
    private PreserverOptions defaultOptions = PreserverOptions.getDefault();

    private long initialBackoffMs = defaultOptions.initialBackoffMs();
    private long maxBackoffMs = defaultOptions.maxBackoffMs();
    private double backoffMultiplier = defaultOptions.backoffMultiplier();
    private int backoffAfterAttempts = defaultOptions.backoffAfterAttempts();
    private long drainPollIntervalMs = defaultOptions.drainPollIntervalMs();

    private PreserverOptionsBuilder() {}

    /**
     * Sets the first delay applied to a batch that keeps failing.
     *
     * @param initialBackoffMs the initial backoff in milliseconds
     * @return this builder for method chaining
     * @throws IllegalArgumentException if initialBackoffMs is negative
     */
    public PreserverOptionsBuilder setInitialBackoffMs(long initialBackoffMs) {
      if (initialBackoffMs < 0) {
        throw new IllegalArgumentException("initialBackoffMs must not be negative");
      }
      this.initialBackoffMs = initialBackoffMs;
      return this;
    }

    /**
     * Sets the ceiling on the delay between redeliveries of the same batch.
     *
     * @param maxBackoffMs the maximum backoff in milliseconds
     * @return this builder for method chaining
     * @throws IllegalArgumentException if maxBackoffMs is negative
     */
    public PreserverOptionsBuilder setMaxBackoffMs(long maxBackoffMs) {
      if (maxBackoffMs < 0) {
        throw new IllegalArgumentException("maxBackoffMs must not be negative");
      }
      this.maxBackoffMs = maxBackoffMs;
      return this;
    }

    /**
     * Sets the factor applied to the delay after every delayed redelivery.
     *
     * @param backoffMultiplier the backoff multiplier
     * @return this builder for method chaining
     * @throws IllegalArgumentException if backoffMultiplier is less than 1.0
     */
    public PreserverOptionsBuilder setBackoffMultiplier(double backoffMultiplier) {
      if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
        throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
      }
      this.backoffMultiplier = backoffMultiplier;
      return this;
    }

    /**
     * Sets how many redeliveries of a batch happen without any delay.
     *
     * @param backoffAfterAttempts the number of undelayed redeliveries
     * @return this builder for method chaining
     * @throws IllegalArgumentException if backoffAfterAttempts is negative
     */
    public PreserverOptionsBuilder setBackoffAfterAttempts(int backoffAfterAttempts) {
      if (backoffAfterAttempts < 0) {
        throw new IllegalArgumentException("backoffAfterAttempts must not be negative");
      }
      this.backoffAfterAttempts = backoffAfterAttempts;
      return this;
    }

    /**
     * Sets how often outstanding acknowledgments are checked while draining a closed source.
     *
     * @param drainPollIntervalMs the drain poll interval in milliseconds
     * @return this builder for method chaining
     * @throws IllegalArgumentException if drainPollIntervalMs is not positive
     */
    public PreserverOptionsBuilder setDrainPollIntervalMs(long drainPollIntervalMs) {
      if (drainPollIntervalMs <= 0) {
        throw new IllegalArgumentException("drainPollIntervalMs must be positive");
      }
      this.drainPollIntervalMs = drainPollIntervalMs;
      return this;
    }

    /**
     * Builds a new PreserverOptions instance.
     *
     * @return a new PreserverOptions with the configured settings
     * @throws IllegalArgumentException if maxBackoffMs is smaller than initialBackoffMs
     */
    public PreserverOptions build() {
      if (maxBackoffMs < initialBackoffMs) {
        throw new IllegalArgumentException("maxBackoffMs must not be smaller than initialBackoffMs");
      }
      return new PreserverOptions(
          this.initialBackoffMs,
          this.maxBackoffMs,
          this.backoffMultiplier,
          this.backoffAfterAttempts,
          this.drainPollIntervalMs);
    }
  }
}
