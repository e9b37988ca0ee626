package com.tmdbsync.ingestion.client;

import java.time.Duration;

/**
 * Raw HTTP outcome. {@code retryAfter} is the parsed Retry-After hint, null when absent or unparseable.
 */
public record ApiResponse(int status, String body, Duration retryAfter) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
