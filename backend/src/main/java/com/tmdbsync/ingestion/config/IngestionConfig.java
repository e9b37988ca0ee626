package com.tmdbsync.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tmdbsync.common.RateLimiter;
import com.tmdbsync.common.RetryPolicy;
import com.tmdbsync.common.Sleeper;
import com.tmdbsync.config.AsyncConfig;
import com.tmdbsync.ingestion.catalog.TmdbEntityCatalog;
import com.tmdbsync.ingestion.client.BearerTokenLoader;
import com.tmdbsync.ingestion.client.TmdbHttpClient;
import com.tmdbsync.ingestion.client.TmdbRequestExecutor;
import com.tmdbsync.ingestion.client.WebClientTmdbHttpClient;
import com.tmdbsync.ingestion.job.ConcurrentFetchScheduler;
import com.tmdbsync.ingestion.store.ExistingStateScanner;
import com.tmdbsync.ingestion.store.NdjsonCodec;
import com.tmdbsync.ingestion.store.RunLogAppender;
import com.tmdbsync.ingestion.target.TargetSetBuilder;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the TMDB client, the shared rate limiter and retry policy, and the store components from
 * {@code tmdbsync.*} properties.
 */
@Configuration
@EnableConfigurationProperties({ TmdbApiProperties.class, IngestionRetryProperties.class, FetchProperties.class, StorageProperties.class, RunnerProperties.class })
public class IngestionConfig {

    /** Largest response body buffered in memory (series payloads with many seasons run to a few hundred KB). */
    private static final int MAX_RESPONSE_BYTES = 2 * 1024 * 1024;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** One limiter per process, shared by every worker and every retry. */
    @Bean
    public RateLimiter tmdbRateLimiter(TmdbApiProperties apiProperties) {
        return new RateLimiter(Math.max(1, apiProperties.getRequestsPerSecond()));
    }

    @Bean
    public RetryPolicy retryPolicy(IngestionRetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getMinMultiplier(),
                retryProperties.getMaxMultiplier(),
                retryProperties.getMaxDelayMs(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public TmdbHttpClient tmdbHttpClient(WebClient.Builder webClientBuilder, TmdbApiProperties apiProperties) {
        String token = BearerTokenLoader.load(Path.of(apiProperties.getSecretsFile()));
        Duration readTimeout = Duration.ofSeconds(apiProperties.getReadTimeoutSeconds());
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, apiProperties.getConnectTimeoutSeconds() * 1000)
                .responseTimeout(readTimeout);
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(apiProperties.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES));
        // Block slightly longer than the socket timeout so the connector reports the failure first.
        return new WebClientTmdbHttpClient(builder, token, apiProperties.getUserAgent(), readTimeout.plusSeconds(5));
    }

    @Bean
    public TmdbRequestExecutor tmdbRequestExecutor(TmdbHttpClient tmdbHttpClient, RateLimiter tmdbRateLimiter,
                                                   RetryPolicy retryPolicy, ObjectMapper objectMapper) {
        return new TmdbRequestExecutor(tmdbHttpClient, tmdbRateLimiter, retryPolicy, objectMapper,
                Sleeper.threadSleep());
    }

    @Bean
    public NdjsonCodec ndjsonCodec(ObjectMapper objectMapper) {
        return new NdjsonCodec(objectMapper);
    }

    @Bean
    public ExistingStateScanner existingStateScanner(NdjsonCodec ndjsonCodec) {
        return new ExistingStateScanner(ndjsonCodec);
    }

    @Bean
    public TargetSetBuilder targetSetBuilder() {
        return new TargetSetBuilder();
    }

    @Bean
    public RunLogAppender runLogAppender(StorageProperties storageProperties) {
        return new RunLogAppender(Path.of(storageProperties.getLogsDir()));
    }

    @Bean
    public ConcurrentFetchScheduler concurrentFetchScheduler(@Qualifier(AsyncConfig.FETCH_EXECUTOR) Executor fetchExecutor,
                                                             FetchProperties fetchProperties) {
        return new ConcurrentFetchScheduler(fetchExecutor, fetchProperties.inFlightWindow());
    }

    @Bean
    public TmdbEntityCatalog tmdbEntityCatalog(StorageProperties storageProperties, NdjsonCodec ndjsonCodec) {
        return new TmdbEntityCatalog(Path.of(storageProperties.getDataDir()), ndjsonCodec);
    }
}
