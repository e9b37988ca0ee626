package com.tmdbsync.ingestion.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.tmdbsync.ingestion.store.NdjsonCodec;
import com.tmdbsync.ingestion.store.StoreAccessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One call per language code found in the languages store, with the code passed as {@code ?language=}.
 */
@Slf4j
@RequiredArgsConstructor
public class LanguageCodeCalls implements RebuildCallSource {

    private final NdjsonCodec codec;
    private final Path languagesStore;
    private final String path;

    @Override
    public List<RebuildCall> calls() {
        if (!Files.isRegularFile(languagesStore)) {
            throw new StoreAccessException("Languages store not found: " + languagesStore);
        }
        Set<String> codes = new LinkedHashSet<>();
        int unparseable = codec.forEachRecord(languagesStore, record -> {
            JsonNode code = record.get("iso_639_1");
            if (code != null && code.isTextual() && !code.textValue().isBlank()) {
                codes.add(code.textValue().trim());
            }
        });
        if (unparseable > 0) {
            log.warn("{}: {} invalid JSON line(s)", languagesStore.getFileName(), unparseable);
        }
        List<RebuildCall> calls = new ArrayList<>(codes.size());
        for (String code : codes) {
            calls.add(new RebuildCall(code, path, Map.of("language", code)));
        }
        return calls;
    }
}
