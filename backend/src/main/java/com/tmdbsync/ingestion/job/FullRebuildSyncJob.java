package com.tmdbsync.ingestion.job;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tmdbsync.common.ErrorCounter;
import com.tmdbsync.domain.IdentityKey;
import com.tmdbsync.domain.SyncRunSummary;
import com.tmdbsync.domain.TargetState;
import com.tmdbsync.ingestion.catalog.RebuildCall;
import com.tmdbsync.ingestion.catalog.RebuildDescriptor;
import com.tmdbsync.ingestion.client.FetchResult;
import com.tmdbsync.ingestion.client.TmdbRequestExecutor;
import com.tmdbsync.ingestion.config.StorageProperties;
import com.tmdbsync.ingestion.refresh.RefreshPolicy;
import com.tmdbsync.ingestion.store.AtomicMergeWriter;
import com.tmdbsync.ingestion.store.ExistingState;
import com.tmdbsync.ingestion.store.ExistingStateScanner;
import com.tmdbsync.ingestion.store.NdjsonCodec;
import com.tmdbsync.ingestion.store.RunLogAppender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Regenerates a reference store from scratch. Calls run concurrently but rows are written in call order, so
 * identical responses give a byte-identical store. Rows with a key already written are skipped.
 * <p>
 * If every call fails the previous store is kept; a partial rebuild is committed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FullRebuildSyncJob {

    private final TmdbRequestExecutor requestExecutor;
    private final ExistingStateScanner scanner;
    private final ConcurrentFetchScheduler scheduler;
    private final NdjsonCodec codec;
    private final RunLogAppender runLog;
    private final StorageProperties storageProperties;
    private final Clock clock;

    public SyncRunSummary run(RebuildDescriptor entity) {
        LocalDate today = LocalDate.now(clock);
        Path store = Path.of(storageProperties.getDataDir()).resolve(entity.storeFileName());
        ExistingState previous = scanner.scan(store, entity.keySchema(), RefreshPolicy.never(), today);

        List<RebuildCall> calls = entity.calls().calls();
        if (calls.isEmpty()) {
            log.warn("[{}] nothing to request; store left untouched", entity.name());
            return keepPrevious(entity, previous, Map.of(), today);
        }

        ErrorCounter errors = new ErrorCounter();
        AtomicReferenceArray<List<ObjectNode>> rowsByCall = new AtomicReferenceArray<>(calls.size());
        List<Integer> indexes = IntStream.range(0, calls.size()).boxed().collect(Collectors.toList());
        DispatchReport report = scheduler.dispatch(indexes, i -> {
            RebuildCall call = calls.get(i);
            FetchResult result = requestExecutor.execute(call.path(), call.queryParams(), errors);
            if (!result.isSuccess()) {
                log.warn("[{}] call {} failed: {}", entity.name(), call.label(), result.failureCategory());
                return result.state();
            }
            rowsByCall.set(i, entity.rowProjector().project(result.payload(), call.queryParams()));
            return TargetState.SUCCEEDED;
        });

        if (report.count(TargetState.SUCCEEDED) == 0) {
            log.warn("[{}] all {} call(s) failed; previous store kept", entity.name(), calls.size());
            return keepPrevious(entity, previous, errors.snapshot(), today);
        }

        int added = 0;
        int updated = 0;
        int dropped = 0;
        Set<IdentityKey> written = new HashSet<>();
        try (AtomicMergeWriter writer = AtomicMergeWriter.rebuild(store, codec)) {
            for (int i = 0; i < calls.size(); i++) {
                List<ObjectNode> rows = rowsByCall.get(i);
                if (rows == null) {
                    continue;
                }
                for (ObjectNode row : rows) {
                    Optional<IdentityKey> key = entity.keySchema().extract(row);
                    if (key.isEmpty() || !written.add(key.get())) {
                        dropped++;
                        continue;
                    }
                    writer.append(row);
                    if (previous.contains(key.get())) {
                        updated++;
                    } else {
                        added++;
                    }
                }
            }
            writer.commit();
        }
        if (dropped > 0) {
            log.debug("[{}] skipped {} keyless or duplicate row(s)", entity.name(), dropped);
        }

        SyncRunSummary summary = new SyncRunSummary(entity.name(), added, updated, 0, added + updated,
                errors.snapshot(), previous.malformedLines());
        runLog.append(summary, today);
        log.info("[{}] rebuilt from {}/{} call(s): total {}, errors {}", entity.name(),
                report.count(TargetState.SUCCEEDED), calls.size(), summary.total(), summary.errors());
        return summary;
    }

    private SyncRunSummary keepPrevious(RebuildDescriptor entity, ExistingState previous,
                                        Map<String, Integer> errors, LocalDate today) {
        SyncRunSummary summary = new SyncRunSummary(entity.name(), 0, 0, previous.validLines(),
                previous.validLines(), errors, previous.malformedLines());
        runLog.append(summary, today);
        return summary;
    }
}
