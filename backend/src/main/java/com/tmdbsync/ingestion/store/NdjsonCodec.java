package com.tmdbsync.ingestion.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * One compact JSON object per line, UTF-8, non-ASCII left unescaped.
 */
public class NdjsonCodec {

    private final ObjectMapper objectMapper;

    public NdjsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses one line; null when the line is not a JSON object.
     */
    public JsonNode parse(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(line);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public String write(JsonNode record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise record", e);
        }
    }

    /**
     * Streams every parseable object of a file to {@code sink}. Blank lines are ignored.
     *
     * @return number of non-blank lines that were not JSON objects
     */
    public int forEachRecord(Path file, Consumer<JsonNode> sink) {
        int malformed = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node = parse(line);
                if (node == null) {
                    malformed++;
                    continue;
                }
                sink.accept(node);
            }
        } catch (IOException e) {
            throw new StoreAccessException("Cannot read " + file, e);
        }
        return malformed;
    }
}
