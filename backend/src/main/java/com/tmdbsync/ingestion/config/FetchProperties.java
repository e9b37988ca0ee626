package com.tmdbsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Worker pool and admission window for the concurrent fetch phase.
 */
@ConfigurationProperties(prefix = "tmdbsync.ingestion.fetch")
@NoArgsConstructor
@Getter
@Setter
public class FetchProperties {

    /** Threads issuing blocking API calls. */
    private int workerThreads = 64;

    /** In-flight window = workerThreads * inFlightMultiplier. */
    private int inFlightMultiplier = 4;

    /** Log a progress line every N completed targets. */
    private int progressLogInterval = 500;

    public int inFlightWindow() {
        return Math.max(1, workerThreads) * Math.max(1, inFlightMultiplier);
    }
}
