package com.ivamare.ordersaga.policy;

/**
 * Policy for retrying a handling attempt that lost a stream race or hit a
 * transient database error.
 *
 * @param maxAttempts Maximum number of attempts, including the first
 * @param initialBackoffMs Delay before the second attempt
 * @param maxBackoffMs Upper bound for any delay
 * @param multiplier Growth factor between consecutive delays
 */
public record RetryPolicy(
    int maxAttempts,
    long initialBackoffMs,
    long maxBackoffMs,
    double multiplier
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("Backoff bounds must satisfy 0 <= initial <= max");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    /**
     * Default retry policy: 5 attempts, 20ms doubling up to 1s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(5, 20, 1000, 2.0);
    }

    /**
     * Create a policy with no retries.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 0, 0, 1.0);
    }

    /**
     * Check if another attempt should be made after {@code attempt} failed.
     *
     * @param attempt The attempt that failed (1-based)
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Delay before the attempt following {@code attempt}, with +/- 10% jitter.
     *
     * @param attempt The attempt that failed (1-based)
     * @return the delay in milliseconds
     */
    public long backoffMillis(int attempt) {
        if (attempt <= 0 || initialBackoffMs == 0) {
            return initialBackoffMs;
        }
        double delay = initialBackoffMs * Math.pow(multiplier, attempt - 1);
        double jitter = delay * 0.1 * (Math.random() * 2 - 1);
        return Math.max(0, Math.min((long) (delay + jitter), maxBackoffMs));
    }
}
