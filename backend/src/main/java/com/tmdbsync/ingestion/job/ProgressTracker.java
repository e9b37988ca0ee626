package com.tmdbsync.ingestion.job;

import com.tmdbsync.common.ErrorCounter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live counters for one entity's fetch phase. Logs a progress line every {@code logInterval} completions and once
 * more when asked at the end. Safe to call from any worker.
 */
@Slf4j
public class ProgressTracker {

    private final String entity;
    private final int total;
    private final int logInterval;
    private final ErrorCounter errors;
    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger added = new AtomicInteger();
    private final AtomicInteger updated = new AtomicInteger();
    private final AtomicInteger empty = new AtomicInteger();

    public ProgressTracker(String entity, int total, int logInterval, ErrorCounter errors) {
        this.entity = entity;
        this.total = total;
        this.logInterval = Math.max(1, logInterval);
        this.errors = errors;
    }

    public void recordSuccess(boolean newRecord) {
        if (newRecord) {
            added.incrementAndGet();
        } else {
            updated.incrementAndGet();
        }
        completed();
    }

    /** Fetched fine but projected to no rows, so nothing was written for the key. */
    public void recordEmpty() {
        empty.incrementAndGet();
        completed();
    }

    public void recordFailure() {
        completed();
    }

    private void completed() {
        int done = processed.incrementAndGet();
        if (done % logInterval == 0 && done < total) {
            logLine(done);
        }
    }

    public void logFinal() {
        logLine(processed.get());
    }

    private void logLine(int done) {
        log.info("[{}] {}/{} processed, ok {} (added {}, updated {}), no rows {}, errors {}",
                entity, done, total, added.get() + updated.get(), added.get(), updated.get(), empty.get(),
                errors.total());
    }

    public int getProcessed() {
        return processed.get();
    }

    public int getAdded() {
        return added.get();
    }

    public int getUpdated() {
        return updated.get();
    }

    public int getEmpty() {
        return empty.get();
    }
}
