package com.tmdbsync.ingestion.client;

/**
 * Thrown when a TMDB API call fails outside the per-key failure taxonomy (interrupted retry, transport setup).
 */
public class TmdbApiException extends RuntimeException {

    public TmdbApiException(String message) {
        super(message);
    }

    public TmdbApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
