package com.tmdbsync.ingestion.client;

import java.util.Map;

/**
 * One authenticated GET against the TMDB API. Implementations return every HTTP status as an
 * {@link ApiResponse} and throw {@link ApiTransportException} only when no status was received.
 */
public interface TmdbHttpClient {

    ApiResponse get(String path, Map<String, String> queryParams);
}
