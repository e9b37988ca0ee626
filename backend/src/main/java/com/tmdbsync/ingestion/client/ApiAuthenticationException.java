package com.tmdbsync.ingestion.client;

/**
 * HTTP 401 from the API. The credential fails on every call, so this aborts the whole run.
 */
public class ApiAuthenticationException extends TmdbApiException {

    public ApiAuthenticationException(String message) {
        super(message);
    }
}
