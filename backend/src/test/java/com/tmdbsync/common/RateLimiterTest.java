package com.tmdbsync.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    @Test
    @DisplayName("tryAcquire grants up to the budget and denies the next call in the same window")
    void tryAcquireWithinWindow() {
        RateLimiter limiter = new RateLimiter(3);
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isTrue();
        assertThat(limiter.tryAcquire()).isFalse();
    }

    @Test
    @DisplayName("acquire blocks until the oldest grant leaves the window")
    void acquireBlocksThenAllows() {
        RateLimiter limiter = new RateLimiter(1, Duration.ofMillis(300));
        limiter.acquire();
        long start = System.nanoTime();
        limiter.acquire();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(elapsedMs).isGreaterThanOrEqualTo(250);
    }

    @Test
    @DisplayName("concurrent callers never exceed the budget in any window")
    void multipleThreadsRespectRate() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(10, Duration.ofMillis(500));
        int threadCount = 5;
        int acquiresPerThread = 4;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger(0);
        long begin = System.nanoTime();
        for (int t = 0; t < threadCount; t++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < acquiresPerThread; i++) {
                        limiter.acquire();
                        successCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }).start();
        }
        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        long elapsedMs = (System.nanoTime() - begin) / 1_000_000;
        assertThat(successCount.get()).isEqualTo(threadCount * acquiresPerThread);
        // 20 grants at 10 per 500ms need at least one full window of waiting
        assertThat(elapsedMs).isGreaterThanOrEqualTo(450);
    }

    @Test
    @DisplayName("constructor rejects non-positive rate")
    void constructorRejectsNonPositive() {
        assertThatThrownBy(() -> new RateLimiter(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }
}
