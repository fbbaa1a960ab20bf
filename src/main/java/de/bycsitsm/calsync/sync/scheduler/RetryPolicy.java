package de.bycsitsm.calsync.sync.scheduler;

import java.time.Duration;

/**
 * Bounded exponential backoff: the delay doubles after every failed attempt,
 * starting at {@code baseDelay} and never exceeding {@code maxDelay}.
 *
 * @param baseDelay   the delay before the first retry
 * @param maxDelay    the upper bound of every delay
 * @param maxAttempts the total number of attempts per run, the first one included
 */
public record RetryPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {

    public RetryPolicy {
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Retry delays must satisfy 0 <= base-delay <= max-delay.");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("At least one attempt is required.");
        }
    }

    /**
     * Returns whether another attempt may follow the given number of failed attempts.
     */
    public boolean allowsRetryAfter(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }

    /**
     * Returns the delay before the attempt that follows the given number of failed attempts.
     *
     * @param failedAttempts the number of attempts that failed so far, at least 1
     */
    public Duration delayAfter(int failedAttempts) {
        if (failedAttempts < 1) {
            throw new IllegalArgumentException("failedAttempts must be at least 1");
        }
        // 2^30 already exceeds any sensible cap, avoid overflowing the shift
        int exponent = Math.min(failedAttempts - 1, 30);
        var delay = baseDelay.multipliedBy(1L << exponent);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
