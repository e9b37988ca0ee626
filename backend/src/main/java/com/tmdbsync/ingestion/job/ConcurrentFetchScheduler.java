package com.tmdbsync.ingestion.job;

import com.tmdbsync.domain.TargetState;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;

/**
 * Runs one task per item on a worker pool while holding at most {@code window} items in flight, so memory stays
 * bounded no matter how many items a run has. Items are admitted in list order; completion order is free.
 * <p>
 * A task that throws is fatal for the dispatch: no further items are admitted, in-flight tasks are drained and the
 * exception is rethrown to the caller. Per-item failures must therefore be reported as a {@link TargetState}.
 */
@Slf4j
public class ConcurrentFetchScheduler {

    private final Executor executor;
    private final int window;

    public ConcurrentFetchScheduler(Executor executor, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.executor = executor;
        this.window = window;
    }

    public int getWindow() {
        return window;
    }

    /**
     * Every item moves {@code PENDING -> IN_FLIGHT -> terminal} at most once; the report tallies the terminal states.
     */
    public <T> DispatchReport dispatch(List<T> items, Function<T, TargetState> task) {
        Semaphore slots = new Semaphore(window);
        AtomicReference<RuntimeException> fatal = new AtomicReference<>();
        AtomicReferenceArray<TargetState> states = new AtomicReferenceArray<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            states.set(i, TargetState.PENDING);
        }
        int submitted = 0;
        try {
            for (T item : items) {
                slots.acquire();
                if (fatal.get() != null) {
                    slots.release();
                    break;
                }
                int index = submitted;
                states.set(index, TargetState.IN_FLIGHT);
                try {
                    executor.execute(() -> runOne(index, item, task, states, fatal, slots));
                } catch (RejectedExecutionException e) {
                    states.set(index, TargetState.PENDING);
                    slots.release();
                    fatal.compareAndSet(null, e);
                    break;
                }
                submitted++;
            }
            slots.acquire(window);
            slots.release(window);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while dispatching fetch tasks", e);
        }
        Map<TargetState, Integer> tally = new EnumMap<>(TargetState.class);
        for (int i = 0; i < states.length(); i++) {
            tally.merge(states.get(i), 1, Integer::sum);
        }
        RuntimeException failure = fatal.get();
        if (failure != null) {
            log.warn("Dispatch aborted after {} of {} item(s), {} never started: {}", submitted, items.size(),
                    tally.getOrDefault(TargetState.PENDING, 0), failure.getMessage());
            throw failure;
        }
        return new DispatchReport(submitted, tally);
    }

    private <T> void runOne(int index, T item, Function<T, TargetState> task, AtomicReferenceArray<TargetState> states,
                            AtomicReference<RuntimeException> fatal, Semaphore slots) {
        try {
            if (fatal.get() != null) {
                // Admitted but never run: the item stays in flight and the dispatch is rethrown anyway.
                return;
            }
            TargetState state = task.apply(item);
            if (state == null || !state.isTerminal()) {
                throw new IllegalStateException("Task for " + item + " ended in non-terminal state " + state);
            }
            if (!states.compareAndSet(index, TargetState.IN_FLIGHT, state)) {
                throw new IllegalStateException("Item " + item + " completed twice");
            }
        } catch (RuntimeException e) {
            fatal.compareAndSet(null, e);
        } finally {
            slots.release();
        }
    }
}
