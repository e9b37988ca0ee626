package com.tmdbsync.ingestion.client;

/**
 * Connection failure, reset or socket timeout before an HTTP status was received. Retried like a 429.
 */
public class ApiTransportException extends TmdbApiException {

    public ApiTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
