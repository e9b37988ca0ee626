package com.tmdbsync.ingestion.store;

import com.tmdbsync.domain.IdentityKey;
import com.tmdbsync.domain.KeySchema;
import com.tmdbsync.ingestion.refresh.RefreshPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Streams a store once, collecting identity keys and the keys its refresh policy marks as due.
 * Unparseable or keyless lines are skipped and counted, never fatal.
 */
@Slf4j
@RequiredArgsConstructor
public class ExistingStateScanner {

    private final NdjsonCodec codec;

    public ExistingState scan(Path store, KeySchema keySchema, RefreshPolicy refreshPolicy, LocalDate today) {
        if (!Files.exists(store)) {
            return ExistingState.empty();
        }
        Set<IdentityKey> keys = new HashSet<>();
        Set<IdentityKey> due = new LinkedHashSet<>();
        AtomicInteger valid = new AtomicInteger();
        AtomicInteger keyless = new AtomicInteger();

        int unparseable = codec.forEachRecord(store, record -> {
            Optional<IdentityKey> key = keySchema.extract(record);
            if (key.isEmpty()) {
                keyless.incrementAndGet();
                return;
            }
            keys.add(key.get());
            valid.incrementAndGet();
            if (refreshPolicy.isDue(record, today)) {
                due.add(key.get());
            }
        });

        int malformed = unparseable + keyless.get();
        if (malformed > 0) {
            log.warn("{}: skipped {} malformed line(s) ({} unparseable, {} without {})",
                    store.getFileName(), malformed, unparseable, keyless.get(), keySchema.fields());
        }
        return new ExistingState(keys, due, valid.get(), malformed);
    }
}
