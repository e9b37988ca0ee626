package com.tmdbsync.ingestion.client;

/**
 * Secrets file or bearer token absent. Raised at startup, before any network activity.
 */
public class MissingCredentialsException extends RuntimeException {

    public MissingCredentialsException(String message) {
        super(message);
    }
}
