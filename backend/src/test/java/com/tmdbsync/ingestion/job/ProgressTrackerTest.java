package com.tmdbsync.ingestion.job;

import com.tmdbsync.common.ErrorCounter;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressTrackerTest {

    @Test
    void countsAreExactUnderConcurrency() throws Exception {
        ErrorCounter errors = new ErrorCounter();
        ProgressTracker tracker = new ProgressTracker("movie_details", 3_000, 500, errors);
        ExecutorService pool = Executors.newFixedThreadPool(6);
        for (int i = 0; i < 3_000; i++) {
            int n = i;
            pool.execute(() -> {
                if (n % 3 == 0) {
                    errors.increment("HTTP_404");
                    tracker.recordFailure();
                } else {
                    tracker.recordSuccess(n % 3 == 1);
                }
            });
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        tracker.logFinal();

        assertThat(tracker.getProcessed()).isEqualTo(3_000);
        assertThat(tracker.getAdded()).isEqualTo(1_000);
        assertThat(tracker.getUpdated()).isEqualTo(1_000);
        assertThat(errors.get("HTTP_404")).isEqualTo(1_000);
    }

    @Test
    void emptyResultsAreProcessedButNeitherAddedNorUpdated() {
        ProgressTracker tracker = new ProgressTracker("watch_providers_movies", 3, 10, new ErrorCounter());

        tracker.recordEmpty();
        tracker.recordSuccess(true);
        tracker.recordEmpty();

        assertThat(tracker.getProcessed()).isEqualTo(3);
        assertThat(tracker.getEmpty()).isEqualTo(2);
        assertThat(tracker.getAdded()).isEqualTo(1);
        assertThat(tracker.getUpdated()).isZero();
    }
}
