package com.tmdbsync.ingestion.catalog;

/**
 * Common view of catalog entries, incremental or rebuilt.
 */
public interface SyncEntity {

    String name();

    String storeFileName();
}
