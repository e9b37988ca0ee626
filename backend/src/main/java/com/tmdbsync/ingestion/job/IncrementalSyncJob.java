package com.tmdbsync.ingestion.job;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.common.ErrorCounter;
import com.tmdbsync.domain.Candidate;
import com.tmdbsync.domain.IdentityKey;
import com.tmdbsync.domain.SyncRunSummary;
import com.tmdbsync.domain.TargetState;
import com.tmdbsync.ingestion.catalog.EntityDescriptor;
import com.tmdbsync.ingestion.client.FetchResult;
import com.tmdbsync.ingestion.client.TmdbRequestExecutor;
import com.tmdbsync.ingestion.config.FetchProperties;
import com.tmdbsync.ingestion.config.StorageProperties;
import com.tmdbsync.ingestion.store.AtomicMergeWriter;
import com.tmdbsync.ingestion.store.ExistingState;
import com.tmdbsync.ingestion.store.ExistingStateScanner;
import com.tmdbsync.ingestion.store.NdjsonCodec;
import com.tmdbsync.ingestion.store.RunLogAppender;
import com.tmdbsync.ingestion.target.TargetSet;
import com.tmdbsync.ingestion.target.TargetSetBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * One incremental run of an entity:
 * <ol>
 *   <li>read candidates and scan the existing store;</li>
 *   <li>targets = new keys, then keys due for refresh;</li>
 *   <li>copy non-target lines into a temp file, fetch targets concurrently and append their projections;</li>
 *   <li>rename the temp file over the store and append the run log line.</li>
 * </ol>
 * With no targets the store is not touched and no request is made. A failed refresh target loses its previous
 * record for this run; it comes back as a new key on the next run.
 * <p>
 * Added and updated count keys; the store total counts lines, which differ for entities writing several rows
 * per key. A key whose payload projects to no rows is fetched again on the next run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IncrementalSyncJob {

    private final TmdbRequestExecutor requestExecutor;
    private final ExistingStateScanner scanner;
    private final TargetSetBuilder targetSetBuilder;
    private final ConcurrentFetchScheduler scheduler;
    private final NdjsonCodec codec;
    private final RunLogAppender runLog;
    private final StorageProperties storageProperties;
    private final FetchProperties fetchProperties;
    private final Clock clock;

    public SyncRunSummary run(EntityDescriptor entity) {
        LocalDate today = LocalDate.now(clock);
        Path store = Path.of(storageProperties.getDataDir()).resolve(entity.storeFileName());

        List<Candidate> candidates = entity.candidates().candidates();
        if (candidates.isEmpty()) {
            log.warn("[{}] no candidates; only refresh targets will be fetched", entity.name());
        }
        ExistingState existing = scanner.scan(store, entity.keySchema(), entity.refreshPolicy(), today);
        TargetSet targets = targetSetBuilder.build(candidates, existing, entity.refreshPolicy(), today);
        log.info("[{}] candidates {}, existing {}, targets {} (added ~{}, updated ~{})", entity.name(),
                candidates.size(), existing.validLines(), targets.size(), targets.newCount(), targets.staleCount());

        if (targets.isEmpty()) {
            SyncRunSummary summary = new SyncRunSummary(entity.name(), 0, 0, existing.validLines(),
                    existing.validLines(), Map.of(), existing.malformedLines());
            runLog.append(summary, today);
            log.info("[{}] up to date, store left untouched (total {})", entity.name(), summary.total());
            return summary;
        }

        ErrorCounter errors = new ErrorCounter();
        ProgressTracker progress = new ProgressTracker(entity.name(), targets.size(),
                fetchProperties.getProgressLogInterval(), errors);
        int retained;
        int appended;
        try (AtomicMergeWriter writer = AtomicMergeWriter.open(store, entity.keySchema(), targets.keySet(), codec)) {
            scheduler.dispatch(targets.keys(), key -> fetchOne(entity, key, existing, writer, errors, progress));
            progress.logFinal();
            writer.commit();
            retained = writer.getRetained();
            appended = writer.getAppended();
        }

        int lostRefreshes = targets.staleCount() - progress.getUpdated();
        if (lostRefreshes > 0) {
            log.warn("[{}] {} refresh target(s) failed; their previous records were dropped this run",
                    entity.name(), lostRefreshes);
        }
        SyncRunSummary summary = new SyncRunSummary(entity.name(), progress.getAdded(), progress.getUpdated(),
                retained, retained + appended, errors.snapshot(), existing.malformedLines());
        runLog.append(summary, today);
        log.info("[{}] done: added {}, updated {}, retained {}, total {}, errors {} {}", entity.name(),
                summary.added(), summary.updated(), summary.retained(), summary.total(), summary.errorTotal(),
                summary.errors());
        return summary;
    }

    private TargetState fetchOne(EntityDescriptor entity, IdentityKey key, ExistingState existing,
                                 AtomicMergeWriter writer, ErrorCounter errors, ProgressTracker progress) {
        FetchResult result = requestExecutor.execute(entity.endpoint().apply(key), entity.queryParams(), errors);
        if (!result.isSuccess()) {
            log.debug("[{}] {} failed: {}", entity.name(), key, result.failureCategory());
            progress.recordFailure();
            return result.state();
        }
        List<ObjectNode> rows = entity.projector().project(result.payload(), key);
        if (rows.isEmpty()) {
            log.debug("[{}] {} has no rows", entity.name(), key);
            progress.recordEmpty();
            return TargetState.SUCCEEDED;
        }
        for (ObjectNode row : rows) {
            entity.keySchema().stamp(row, key);
        }
        writer.appendAll(rows);
        progress.recordSuccess(!existing.contains(key));
        return TargetState.SUCCEEDED;
    }
}
