package com.tmdbsync.ingestion.catalog;

import com.tmdbsync.domain.IdentityKey;
import com.tmdbsync.domain.KeySchema;
import com.tmdbsync.ingestion.candidate.CandidateSource;
import com.tmdbsync.ingestion.projection.KeyedRowProjector;
import com.tmdbsync.ingestion.projection.RecordProjector;
import com.tmdbsync.ingestion.refresh.RefreshPolicy;

import java.util.Map;
import java.util.function.Function;

/**
 * Everything that differs between incremental entities. The engine itself is shared.
 *
 * @param name          entity name, used for the store file, the run log and {@code --entities}
 * @param storeFileName file name of the store under the data directory
 * @param keySchema     identity fields of a stored record; for entities with several rows per key, the fields
 *                      shared by all rows of one fetched key
 * @param candidates    keys the store should contain
 * @param endpoint      API path for one key
 * @param queryParams   query parameters sent with every request
 * @param projector     payload to the stored rows of one key
 * @param refreshPolicy decides which existing records are re-fetched
 */
public record EntityDescriptor(
        String name,
        String storeFileName,
        KeySchema keySchema,
        CandidateSource candidates,
        Function<IdentityKey, String> endpoint,
        Map<String, String> queryParams,
        KeyedRowProjector projector,
        RefreshPolicy refreshPolicy
) implements SyncEntity {

    public EntityDescriptor {
        queryParams = queryParams == null ? Map.of() : Map.copyOf(queryParams);
        refreshPolicy = refreshPolicy == null ? RefreshPolicy.never() : refreshPolicy;
    }

    /** One stored line per key. */
    public EntityDescriptor(String name, String storeFileName, KeySchema keySchema, CandidateSource candidates,
                            Function<IdentityKey, String> endpoint, Map<String, String> queryParams,
                            RecordProjector projector, RefreshPolicy refreshPolicy) {
        this(name, storeFileName, keySchema, candidates, endpoint, queryParams, KeyedRowProjector.single(projector),
                refreshPolicy);
    }
}
