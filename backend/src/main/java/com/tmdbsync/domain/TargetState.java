package com.tmdbsync.domain;

/**
 * Lifecycle of one target within a run. No transition leads back to {@link #PENDING}.
 */
public enum TargetState {
    PENDING,
    IN_FLIGHT,
    SUCCEEDED,
    /** 404 or any non-retryable status. */
    FAILED_TERMINAL,
    /** 429, network error or unreadable body that outlived the retry budget. */
    FAILED_TRANSIENT_EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED_TERMINAL || this == FAILED_TRANSIENT_EXHAUSTED;
    }
}
