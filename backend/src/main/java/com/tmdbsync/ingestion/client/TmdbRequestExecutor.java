package com.tmdbsync.ingestion.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tmdbsync.common.ErrorCounter;
import com.tmdbsync.common.RateLimiter;
import com.tmdbsync.common.RetryPolicy;
import com.tmdbsync.common.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;

/**
 * Issues one rate-limited GET and classifies the outcome:
 * <ul>
 *   <li>2xx with a JSON object or array: the parsed payload. An empty, scalar or {@code null} body is treated
 *       as unreadable.</li>
 *   <li>404: terminal, counted, no retry.</li>
 *   <li>401: {@link ApiAuthenticationException}, aborts the run.</li>
 *   <li>429, transport failure, unreadable body: retried with backoff (Retry-After honoured for 429) until the
 *       attempt budget is spent, then counted as exhausted.</li>
 *   <li>Any other status: terminal, counted as {@code HTTP_<code>}.</li>
 *   <li>Body over the client's buffer limit: terminal, no retry.</li>
 * </ul>
 * Every attempt, including retries, takes a permit from the shared rate limiter.
 */
@Slf4j
public class TmdbRequestExecutor {

    private final TmdbHttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;

    public TmdbRequestExecutor(TmdbHttpClient httpClient, RateLimiter rateLimiter, RetryPolicy retryPolicy,
                               ObjectMapper objectMapper, Sleeper sleeper) {
        this.httpClient = httpClient;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
    }

    public FetchResult execute(String path, Map<String, String> queryParams, ErrorCounter errors) {
        int attempt = 0;
        while (true) {
            rateLimiter.acquire();
            ApiResponse response;
            try {
                response = httpClient.get(path, queryParams);
            } catch (ResponseTooLargeException e) {
                errors.increment(FailureCategories.RESPONSE_TOO_LARGE);
                log.warn("Dropping {}: {}", path, e.getMessage());
                return FetchResult.terminal(FailureCategories.RESPONSE_TOO_LARGE);
            } catch (ApiTransportException e) {
                log.debug("Transport failure on {} (attempt {}): {}", path, attempt + 1, e.getMessage());
                if (!backoff(path, attempt, null)) {
                    errors.increment(FailureCategories.NETWORK_EXHAUSTED);
                    log.warn("Giving up on {} after {} attempts: {}", path, attempt + 1, e.getMessage());
                    return FetchResult.exhausted(FailureCategories.NETWORK_EXHAUSTED);
                }
                attempt++;
                continue;
            }

            int status = response.status();
            if (response.isSuccess()) {
                String problem;
                try {
                    JsonNode payload = objectMapper.readTree(response.body());
                    if (payload != null && payload.isContainerNode()) {
                        return FetchResult.success(payload);
                    }
                    problem = "not a JSON object or array";
                } catch (JsonProcessingException e) {
                    problem = e.getOriginalMessage();
                }
                log.debug("Unreadable body on {} (attempt {}): {}", path, attempt + 1, problem);
                if (!backoff(path, attempt, null)) {
                    errors.increment(FailureCategories.MALFORMED_RESPONSE_EXHAUSTED);
                    log.warn("Giving up on {} after {} attempts: {}", path, attempt + 1, problem);
                    return FetchResult.exhausted(FailureCategories.MALFORMED_RESPONSE_EXHAUSTED);
                }
                attempt++;
                continue;
            }
            if (status == 404) {
                errors.increment(FailureCategories.NOT_FOUND);
                log.debug("Not found: {}", path);
                return FetchResult.terminal(FailureCategories.NOT_FOUND);
            }
            if (status == 401) {
                throw new ApiAuthenticationException("401 Unauthorized on " + path + ": check the TMDB bearer token");
            }
            if (status == 429) {
                if (!backoff(path, attempt, response.retryAfter())) {
                    errors.increment(FailureCategories.RATE_LIMIT_EXHAUSTED);
                    log.warn("Rate limited on {} after {} attempts; dropping", path, attempt + 1);
                    return FetchResult.exhausted(FailureCategories.RATE_LIMIT_EXHAUSTED);
                }
                attempt++;
                continue;
            }
            String category = FailureCategories.httpStatus(status);
            errors.increment(category);
            log.warn("HTTP {} on {}", status, path);
            return FetchResult.terminal(category);
        }
    }

    /**
     * Sleeps before the next attempt. Returns false, without sleeping, when the attempt budget is spent.
     */
    private boolean backoff(String path, int attempt, Duration serverHint) {
        if (attempt + 1 >= retryPolicy.getMaxAttempts()) {
            return false;
        }
        long delayMs = serverHint != null
                ? retryPolicy.capMs(serverHint.toMillis())
                : retryPolicy.delayMs(attempt);
        log.debug("Retrying {} in {} ms (attempt {} of {})", path, delayMs, attempt + 2, retryPolicy.getMaxAttempts());
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TmdbApiException("Interrupted during retry", e);
        }
        return true;
    }
}
