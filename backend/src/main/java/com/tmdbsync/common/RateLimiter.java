package com.tmdbsync.common;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token-bucket rate limiter over a rolling window. At most {@code permits} acquisitions are granted in any
 * window of length {@code period}; shared by all fetch workers.
 */
public class RateLimiter {

    private final int permits;
    private final long periodNanos;
    private final Deque<Long> grants = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @param permitsPerSecond e.g. 50 for 50 requests per second
     */
    public RateLimiter(int permitsPerSecond) {
        this(permitsPerSecond, Duration.ofSeconds(1));
    }

    public RateLimiter(int permits, Duration period) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive");
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
        this.permits = permits;
        this.periodNanos = period.toNanos();
    }

    /**
     * Blocks until a permit is available, then returns.
     */
    public void acquire() {
        while (true) {
            long sleepNanos;
            lock.lock();
            try {
                long now = System.nanoTime();
                evictExpired(now);
                if (grants.size() < permits) {
                    grants.addLast(now);
                    return;
                }
                sleepNanos = periodNanos - (now - grants.peekFirst());
            } finally {
                lock.unlock();
            }
            sleep(Math.max(sleepNanos, 1_000_000L));
        }
    }

    /**
     * Non-blocking: returns true if a permit was taken, false if would block.
     */
    public boolean tryAcquire() {
        lock.lock();
        try {
            long now = System.nanoTime();
            evictExpired(now);
            if (grants.size() < permits) {
                grants.addLast(now);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void evictExpired(long now) {
        while (!grants.isEmpty() && now - grants.peekFirst() >= periodNanos) {
            grants.pollFirst();
        }
    }

    private static void sleep(long nanos) {
        try {
            Thread.sleep(nanos / 1_000_000, (int) (nanos % 1_000_000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Rate limiter interrupted", e);
        }
    }
}
