package dbgate.resilience;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with proportional jitter.
 *
 * <p>Delay: {@code initial * 2^(n-1)} capped at {@code max}, then scaled by a random factor in
 * {@code [1 - jitter, 1 + jitter)} and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long initialMs;
  private final long maxMs;
  private final double jitter;

  public ExponentialBackoffRetryPolicy(Duration initial, Duration max) {
    this(initial, max, 0.5);
  }

  /**
   * @param jitter fraction in {@code [0, 1)}; 0 disables randomization
   */
  public ExponentialBackoffRetryPolicy(Duration initial, Duration max, double jitter) {
    if (initial == null || initial.isNegative() || initial.isZero()) {
      throw new IllegalArgumentException("initial must be > 0, got: " + initial);
    }
    if (max == null || max.compareTo(initial) < 0) {
      throw new IllegalArgumentException("max must be >= initial, got: " + max);
    }
    if (jitter < 0 || jitter >= 1) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.initialMs = initial.toMillis();
    this.maxMs = max.toMillis();
    this.jitter = jitter;
  }

  @Override
  public Duration delayAfter(int failedAttempts) {
    if (failedAttempts <= 0) {
      return Duration.ZERO;
    }
    long base;
    int shift = failedAttempts - 1;
    if (shift >= 62 || (1L << shift) > maxMs / initialMs) {
      base = maxMs;
    } else {
      base = Math.min(maxMs, initialMs << shift);
    }
    if (jitter == 0) {
      return Duration.ofMillis(base);
    }
    double factor = ThreadLocalRandom.current().nextDouble(1 - jitter, 1 + jitter);
    long delayed = (long) (base * factor);
    return Duration.ofMillis(Math.min(maxMs, Math.max(0L, delayed)));
  }
}
