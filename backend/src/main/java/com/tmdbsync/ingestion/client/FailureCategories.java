package com.tmdbsync.ingestion.client;

/**
 * Labels under which per-key failures are counted and reported in the run log.
 */
public final class FailureCategories {

    public static final String NOT_FOUND = "HTTP_404";
    public static final String RATE_LIMIT_EXHAUSTED = "HTTP_429_exceeded_retries";
    public static final String NETWORK_EXHAUSTED = "NETWORK_exceeded_retries";
    public static final String MALFORMED_RESPONSE_EXHAUSTED = "MALFORMED_RESPONSE_exceeded_retries";
    public static final String RESPONSE_TOO_LARGE = "RESPONSE_TOO_LARGE";

    private FailureCategories() {
    }

    public static String httpStatus(int status) {
        return "HTTP_" + status;
    }
}
