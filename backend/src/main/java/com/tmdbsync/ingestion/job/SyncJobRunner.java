package com.tmdbsync.ingestion.job;

import com.tmdbsync.domain.SyncRunSummary;
import com.tmdbsync.ingestion.catalog.EntityDescriptor;
import com.tmdbsync.ingestion.catalog.RebuildDescriptor;
import com.tmdbsync.ingestion.catalog.SyncEntity;
import com.tmdbsync.ingestion.catalog.TmdbEntityCatalog;
import com.tmdbsync.ingestion.client.ApiAuthenticationException;
import com.tmdbsync.ingestion.config.RunnerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs the selected catalog entities once, in dependency order. {@code --entities=a,b} overrides
 * {@code tmdbsync.runner.entities}.
 * <p>
 * A failing entity is logged and the next one runs; the process then exits with status 1. An authentication
 * failure stops the whole run immediately.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SyncJobRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String ENTITIES_OPTION = "entities";

    private final TmdbEntityCatalog catalog;
    private final IncrementalSyncJob incrementalSyncJob;
    private final FullRebuildSyncJob fullRebuildSyncJob;
    private final RunnerProperties runnerProperties;

    private final List<String> failedEntities = new ArrayList<>();

    @Override
    public void run(ApplicationArguments args) {
        if (!runnerProperties.isEnabled()) {
            log.info("Sync runner disabled");
            return;
        }
        List<SyncEntity> selected = catalog.select(requestedEntities(args));
        log.info("Sync run starting: {}", selected.stream().map(SyncEntity::name).toList());
        List<SyncRunSummary> summaries = new ArrayList<>();
        for (SyncEntity entity : selected) {
            try {
                summaries.add(runOne(entity));
            } catch (ApiAuthenticationException e) {
                log.error("Authentication rejected while syncing {}; aborting run", entity.name());
                throw e;
            } catch (RuntimeException e) {
                failedEntities.add(entity.name());
                log.error("Sync of {} failed: {}", entity.name(), e.getMessage(), e);
            }
        }
        log.info("Sync run finished: {} succeeded, {} failed {}", summaries.size(), failedEntities.size(),
                failedEntities);
    }

    SyncRunSummary runOne(SyncEntity entity) {
        if (entity instanceof EntityDescriptor incremental) {
            return incrementalSyncJob.run(incremental);
        }
        if (entity instanceof RebuildDescriptor rebuild) {
            return fullRebuildSyncJob.run(rebuild);
        }
        throw new IllegalStateException("Unsupported entity type: " + entity.getClass().getName());
    }

    private List<String> requestedEntities(ApplicationArguments args) {
        List<String> values = args.getOptionValues(ENTITIES_OPTION);
        if (values == null || values.isEmpty()) {
            return runnerProperties.getEntities();
        }
        List<String> names = new ArrayList<>();
        for (String value : values) {
            names.addAll(Arrays.asList(value.split(",")));
        }
        return names;
    }

    public List<String> getFailedEntities() {
        return List.copyOf(failedEntities);
    }

    @Override
    public int getExitCode() {
        return failedEntities.isEmpty() ? 0 : 1;
    }
}
