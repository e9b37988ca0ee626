package com.tmdbsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Locations of the line-delimited stores and the per-entity run logs.
 */
@ConfigurationProperties(prefix = "tmdbsync.storage")
@NoArgsConstructor
@Getter
@Setter
public class StorageProperties {

    /** Stores and listing inputs (daily id dumps). */
    private String dataDir = "data/out";

    /** One appended summary file per entity. */
    private String logsDir = "logs/fetch_tmdb";
}
