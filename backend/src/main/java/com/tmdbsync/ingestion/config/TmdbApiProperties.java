package com.tmdbsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Upstream API access: host, throughput budget, timeouts and where the bearer token lives.
 */
@ConfigurationProperties(prefix = "tmdbsync.api")
@NoArgsConstructor
@Getter
@Setter
public class TmdbApiProperties {

    private String baseUrl = "https://api.themoviedb.org/3";

    /** Token bucket: aggregate requests per rolling second across all workers. */
    private int requestsPerSecond = 50;

    private int connectTimeoutSeconds = 10;

    /** Per-request socket timeout; the only timeout bounding an individual call. */
    private int readTimeoutSeconds = 45;

    /** Secrets file holding {@code TMDB_bearer=...}. Relative paths resolve against the working directory. */
    private String secretsFile = ".env";

    private String userAgent = "tmdb-sync/etl";
}
