package com.tmdbsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for transient API failures (exponential backoff with randomised growth). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "tmdbsync.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Delay in ms after the first failed attempt. Default 200. */
    private long baseDelayMs = 200L;

    private double minMultiplier = 1.5;

    private double maxMultiplier = 2.0;

    /** Backoff ceiling, also applied to server Retry-After hints. Default 60s. */
    private long maxDelayMs = 60_000L;

    /** Total attempts per key including the first call. Default 6. */
    private int maxAttempts = 6;
}
