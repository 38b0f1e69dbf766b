package dbgate.resilience;

import java.time.Duration;

/**
 * Strategy for spacing caller-side retries.
 *
 * @see ExponentialBackoffRetryPolicy
 * @see RetryExecutor
 */
public interface RetryPolicy {

    /**
     * Delay before the next attempt.
     *
     * @param failedAttempts attempts made so far (1-based)
     * @return non-negative delay
     */
    Duration delayAfter(int failedAttempts);
}
