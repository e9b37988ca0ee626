package com.tmdbsync.ingestion.store;

/**
 * I/O failure on a store, listing input or run log. Fails the current entity run; the previous store stays
 * in place.
 */
public class StoreAccessException extends RuntimeException {

    public StoreAccessException(String message) {
        super(message);
    }

    public StoreAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
