package com.tmdbsync.ingestion.client;

import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * TMDB client using WebClient. Bearer token and User-Agent are fixed per instance; the base URL comes from
 * the builder.
 */
public class WebClientTmdbHttpClient implements TmdbHttpClient {

    private final WebClient webClient;
    private final Duration blockTimeout;

    public WebClientTmdbHttpClient(WebClient.Builder builder, String bearerToken, String userAgent, Duration blockTimeout) {
        this.webClient = builder
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
        this.blockTimeout = blockTimeout;
    }

    @Override
    public ApiResponse get(String path, Map<String, String> queryParams) {
        try {
            return webClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path(path);
                        if (queryParams != null) {
                            queryParams.forEach(uriBuilder::queryParam);
                        }
                        return uriBuilder.build();
                    })
                    .accept(MediaType.APPLICATION_JSON)
                    .exchangeToMono(response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new ApiResponse(
                                    response.statusCode().value(),
                                    body,
                                    parseRetryAfter(response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER)))))
                    .block(blockTimeout);
        } catch (TmdbApiException e) {
            throw e;
        } catch (RuntimeException e) {
            DataBufferLimitException tooLarge = findCause(e, DataBufferLimitException.class);
            if (tooLarge != null) {
                throw new ResponseTooLargeException("GET " + path + ": " + tooLarge.getMessage(), e);
            }
            throw new ApiTransportException("GET " + path + " failed: " + e.getMessage(), e);
        }
    }

    private static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (type.isInstance(t)) {
                return type.cast(t);
            }
        }
        return null;
    }

    /**
     * Retry-After in delta-seconds (fractions accepted). HTTP-date values are ignored.
     */
    static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double seconds = Double.parseDouble(value.strip());
            if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                return null;
            }
            return Duration.ofMillis((long) (seconds * 1000));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
