package com.tmdbsync.ingestion.candidate;

import com.fasterxml.jackson.databind.JsonNode;
import com.tmdbsync.domain.Candidate;
import com.tmdbsync.domain.IdentityKey;
import com.tmdbsync.ingestion.store.NdjsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Composite keys {@code (parentId, childValue)} read from a list nested in each parent record, e.g.
 * {@code (series id, seasons_index[].season_number)}.
 */
@Slf4j
@RequiredArgsConstructor
public class NestedKeyListing implements CandidateSource {

    private final NdjsonCodec codec;
    private final Path listing;
    private final String parentIdField;
    private final String listField;
    private final String childField;

    @Override
    public List<Candidate> candidates() {
        ListingFiles.requireExists(listing);
        Set<IdentityKey> seen = new LinkedHashSet<>();
        AtomicInteger missing = new AtomicInteger();
        int unparseable = codec.forEachRecord(listing, record -> {
            JsonNode parentId = record.get(parentIdField);
            JsonNode items = record.get(listField);
            if (parentId == null || !parentId.isIntegralNumber() || items == null || !items.isArray()) {
                missing.incrementAndGet();
                return;
            }
            for (JsonNode item : items) {
                JsonNode child = item.get(childField);
                if (child != null && child.isIntegralNumber()) {
                    seen.add(IdentityKey.of(parentId.longValue(), child.longValue()));
                }
            }
        });
        if (unparseable > 0 || missing.get() > 0) {
            log.warn("{}: {} invalid JSON line(s), {} without usable {}",
                    listing.getFileName(), unparseable, missing.get(), listField);
        }
        List<Candidate> out = new ArrayList<>(seen.size());
        seen.forEach(k -> out.add(Candidate.of(k)));
        return out;
    }
}
