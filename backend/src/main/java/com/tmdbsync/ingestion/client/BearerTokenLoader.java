package com.tmdbsync.ingestion.client;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Reads the API bearer token from a {@code KEY=VALUE} secrets file. Blank lines and {@code #} comments are
 * skipped; surrounding quotes on the value are stripped.
 */
@Slf4j
public final class BearerTokenLoader {

    private static final Set<String> TOKEN_KEYS = Set.of("TMDB_bearer", "TMDB_BEARER");

    private BearerTokenLoader() {
    }

    public static String load(Path secretsFile) {
        if (!Files.isRegularFile(secretsFile)) {
            throw new MissingCredentialsException("Secrets file not found: " + secretsFile.toAbsolutePath());
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(secretsFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read secrets file " + secretsFile, e);
        }
        for (String raw : lines) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#") || !line.contains("=")) {
                continue;
            }
            int eq = line.indexOf('=');
            String key = line.substring(0, eq).strip();
            if (!TOKEN_KEYS.contains(key)) {
                continue;
            }
            String value = stripQuotes(line.substring(eq + 1).strip());
            if (!value.isEmpty()) {
                log.info("Loaded TMDB bearer token from {}", secretsFile);
                return value;
            }
        }
        throw new MissingCredentialsException("TMDB_bearer missing in " + secretsFile.toAbsolutePath());
    }

    private static String stripQuotes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && (value.charAt(start) == '"' || value.charAt(start) == '\'')) {
            start++;
        }
        while (end > start && (value.charAt(end - 1) == '"' || value.charAt(end - 1) == '\'')) {
            end--;
        }
        return value.substring(start, end);
    }
}
