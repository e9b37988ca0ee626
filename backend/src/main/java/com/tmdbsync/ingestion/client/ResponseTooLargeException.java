package com.tmdbsync.ingestion.client;

/**
 * The response body exceeded the client's in-memory buffer limit. The same call would fail again, so it is not
 * retried.
 */
public class ResponseTooLargeException extends TmdbApiException {

    public ResponseTooLargeException(String message, Throwable cause) {
        super(message, cause);
    }
}
