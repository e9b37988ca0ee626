package com.tmdbsync.ingestion.candidate;

import com.tmdbsync.domain.Candidate;
import com.tmdbsync.domain.IdentityKey;
import com.tmdbsync.domain.KeySchema;
import com.tmdbsync.ingestion.store.NdjsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keys read from another line-delimited file, e.g. the daily id dump or an already ingested store.
 */
@Slf4j
@RequiredArgsConstructor
public class StoreKeyListing implements CandidateSource {

    private final NdjsonCodec codec;
    private final Path listing;
    private final KeySchema keySchema;

    @Override
    public List<Candidate> candidates() {
        ListingFiles.requireExists(listing);
        Set<IdentityKey> seen = new LinkedHashSet<>();
        AtomicInteger keyless = new AtomicInteger();
        int unparseable = codec.forEachRecord(listing, record -> {
            Optional<IdentityKey> key = keySchema.extract(record);
            if (key.isPresent()) {
                seen.add(key.get());
            } else {
                keyless.incrementAndGet();
            }
        });
        if (unparseable > 0 || keyless.get() > 0) {
            log.warn("{}: {} invalid JSON line(s), {} without usable {}",
                    listing.getFileName(), unparseable, keyless.get(), keySchema.fields());
        }
        List<Candidate> out = new ArrayList<>(seen.size());
        seen.forEach(k -> out.add(Candidate.of(k)));
        return out;
    }
}
