package com.tmdbsync.ingestion.candidate;

import com.fasterxml.jackson.databind.JsonNode;
import com.tmdbsync.domain.Candidate;
import com.tmdbsync.domain.IdentityKey;
import com.tmdbsync.domain.KeySchema;
import com.tmdbsync.ingestion.refresh.DateWindow;
import com.tmdbsync.ingestion.store.NdjsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Child keys derived arithmetically from a parent store: for a parent with key {@code (p...)} and count
 * {@code n}, emits {@code (p..., 1)} through {@code (p..., n)}. The parent's date travels with each candidate.
 * <p>
 * Assumes sequence numbers have no gaps. Children beyond a shrunken count are never pruned.
 */
@Slf4j
@RequiredArgsConstructor
public class SequenceDerivation implements CandidateSource {

    private final NdjsonCodec codec;
    private final Path parentStore;
    private final KeySchema parentKey;
    private final String countField;
    private final String parentDateField;

    @Override
    public List<Candidate> candidates() {
        ListingFiles.requireExists(parentStore);
        List<Candidate> out = new ArrayList<>();
        Set<IdentityKey> seen = new HashSet<>();
        AtomicInteger missing = new AtomicInteger();
        int unparseable = codec.forEachRecord(parentStore, record -> {
            Optional<IdentityKey> parent = parentKey.extract(record);
            JsonNode count = record.get(countField);
            if (parent.isEmpty() || count == null || !count.isIntegralNumber() || count.longValue() < 0) {
                missing.incrementAndGet();
                return;
            }
            LocalDate parentDate = DateWindow.parseField(record, parentDateField);
            for (long n = 1; n <= count.longValue(); n++) {
                List<Object> parts = new ArrayList<>(parent.get().parts());
                parts.add(n);
                IdentityKey key = new IdentityKey(parts);
                if (seen.add(key)) {
                    out.add(new Candidate(key, parentDate));
                }
            }
        });
        if (unparseable > 0 || missing.get() > 0) {
            log.warn("{}: {} invalid JSON line(s), {} without usable {} + {}",
                    parentStore.getFileName(), unparseable, missing.get(), parentKey.fields(), countField);
        }
        log.info("Derived {} candidate(s) from {}", out.size(), parentStore.getFileName());
        return out;
    }
}
