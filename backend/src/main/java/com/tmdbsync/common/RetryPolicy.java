package com.tmdbsync.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with a randomised growth factor for transient API failures (429, network, timeout).
 * Delay for attempt {@code n} (zero-based) is {@code baseDelay * m^n} with {@code m} drawn uniformly from
 * {@code [minMultiplier, maxMultiplier]}, capped at {@code maxDelayMs}.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double minMultiplier;
    private final double maxMultiplier;
    private final long maxDelayMs;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double minMultiplier, double maxMultiplier, long maxDelayMs, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (minMultiplier < 1.0 || maxMultiplier < minMultiplier) {
            throw new IllegalArgumentException("multipliers must satisfy 1.0 <= min <= max");
        }
        this.baseDelayMs = baseDelayMs;
        this.minMultiplier = minMultiplier;
        this.maxMultiplier = maxMultiplier;
        this.maxDelayMs = maxDelayMs;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds before retrying after the given zero-based attempt.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return Math.min(baseDelayMs, maxDelayMs);
        }
        double multiplier = minMultiplier == maxMultiplier
                ? minMultiplier
                : ThreadLocalRandom.current().nextDouble(minMultiplier, maxMultiplier);
        double delay = baseDelayMs * Math.pow(multiplier, Math.min(attempt, 64));
        return (long) Math.min(delay, maxDelayMs);
    }

    /**
     * Server-provided delay, capped at the same ceiling as computed backoff.
     */
    public long capMs(long requestedMs) {
        return Math.max(0, Math.min(requestedMs, maxDelayMs));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Default: 200ms base, x1.5-2.0 per attempt, 60s ceiling, 6 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(200L, 1.5, 2.0, 60_000L, 6);
    }
}
