package com.tmdbsync.ingestion.catalog;

import com.tmdbsync.domain.KeySchema;
import com.tmdbsync.ingestion.projection.RowProjector;

/**
 * A reference entity regenerated from scratch on every run.
 */
public record RebuildDescriptor(
        String name,
        String storeFileName,
        KeySchema keySchema,
        RebuildCallSource calls,
        RowProjector rowProjector
) implements SyncEntity {
}
