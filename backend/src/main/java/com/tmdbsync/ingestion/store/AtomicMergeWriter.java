package com.tmdbsync.ingestion.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.tmdbsync.domain.IdentityKey;
import com.tmdbsync.domain.KeySchema;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the next version of a store in a sibling temp file and swaps it in with an atomic rename.
 * <ol>
 *   <li>{@link #open}: copies every existing line whose key is not a target, byte for byte (retained set).</li>
 *   <li>{@link #append}: adds freshly projected records; serialised so concurrent callers never interleave.</li>
 *   <li>{@link #commit}: renames the temp file over the store.</li>
 * </ol>
 * Readers see either the old store or the new one, also after a crash: the temp file is forced to disk before
 * the rename. The temp file lives in the store's own directory because an atomic rename only holds within one
 * filesystem. Closing without commit discards the temp file.
 */
@Slf4j
public class AtomicMergeWriter implements AutoCloseable {

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path store;
    private final Path tempFile;
    private final NdjsonCodec codec;
    private final FileChannel channel;
    private final BufferedWriter out;
    private final Object writeLock = new Object();
    private int retained;
    private int appended;
    private int malformedDropped;
    private boolean finished;
    private boolean forced;

    private AtomicMergeWriter(Path store, NdjsonCodec codec) throws IOException {
        this.store = store;
        this.tempFile = store.resolveSibling(store.getFileName() + TEMP_SUFFIX);
        this.codec = codec;
        Path parent = store.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        // A temp file left by a killed run is truncated and reused.
        this.channel = FileChannel.open(tempFile,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        this.out = new BufferedWriter(Channels.newWriter(channel, StandardCharsets.UTF_8));
    }

    /**
     * Opens a merge: existing lines for keys outside {@code targets} are carried over unchanged.
     */
    public static AtomicMergeWriter open(Path store, KeySchema keySchema, Set<IdentityKey> targets, NdjsonCodec codec) {
        AtomicMergeWriter writer = null;
        try {
            writer = new AtomicMergeWriter(store, codec);
            writer.copyRetained(keySchema, targets);
            return writer;
        } catch (IOException | RuntimeException e) {
            if (writer != null) {
                writer.close();
            }
            if (e instanceof StoreAccessException sae) {
                throw sae;
            }
            throw new StoreAccessException("Cannot prepare merge for " + store, e);
        }
    }

    /**
     * Opens a full rebuild: nothing is carried over.
     */
    public static AtomicMergeWriter rebuild(Path store, NdjsonCodec codec) {
        try {
            return new AtomicMergeWriter(store, codec);
        } catch (IOException e) {
            throw new StoreAccessException("Cannot prepare rebuild for " + store, e);
        }
    }

    private void copyRetained(KeySchema keySchema, Set<IdentityKey> targets) throws IOException {
        if (!Files.exists(store)) {
            return;
        }
        try (BufferedReader reader = Files.newBufferedReader(store, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                Optional<IdentityKey> key = keySchema.extract(codec.parse(line));
                if (key.isEmpty()) {
                    malformedDropped++;
                    continue;
                }
                if (targets.contains(key.get())) {
                    continue;
                }
                out.write(line);
                out.write('\n');
                retained++;
            }
        }
        if (malformedDropped > 0) {
            log.warn("{}: dropped {} malformed line(s) while copying retained records", store.getFileName(), malformedDropped);
        }
    }

    public void append(JsonNode record) {
        appendAll(List.of(record));
    }

    /**
     * Appends the rows of one key as a contiguous block.
     */
    public void appendAll(List<? extends JsonNode> records) {
        List<String> lines = new ArrayList<>(records.size());
        for (JsonNode record : records) {
            lines.add(codec.write(record));
        }
        synchronized (writeLock) {
            if (finished) {
                throw new IllegalStateException("Writer for " + store + " is already finished");
            }
            try {
                for (String line : lines) {
                    out.write(line);
                    out.write('\n');
                    appended++;
                }
            } catch (IOException e) {
                throw new StoreAccessException("Cannot append to " + tempFile, e);
            }
        }
    }

    /**
     * Flushes and atomically replaces the store with the temp file.
     */
    public void commit() {
        synchronized (writeLock) {
            if (finished) {
                throw new IllegalStateException("Writer for " + store + " is already finished");
            }
            finished = true;
            try {
                out.flush();
                // Data must reach the disk before the rename does, or a power loss can expose an empty store.
                channel.force(true);
                forced = true;
                out.close();
                Files.move(tempFile, store, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                syncDirectory();
            } catch (AtomicMoveNotSupportedException e) {
                discardTemp();
                throw new StoreAccessException("Atomic rename not supported for " + store
                        + "; temp file and store must share a filesystem", e);
            } catch (IOException e) {
                discardTemp();
                throw new StoreAccessException("Cannot replace " + store, e);
            }
        }
    }

    /**
     * Discards the temp file if not committed; the existing store is untouched.
     */
    @Override
    public void close() {
        synchronized (writeLock) {
            if (finished) {
                return;
            }
            finished = true;
            try {
                out.close();
            } catch (IOException e) {
                log.warn("Closing temp file {} failed: {}", tempFile, e.getMessage());
            }
            discardTemp();
        }
    }

    /**
     * Persists the rename itself. Not every platform can open a directory for syncing; there the rename is
     * left to the filesystem.
     */
    private void syncDirectory() {
        Path dir = store.toAbsolutePath().getParent();
        if (dir == null) {
            return;
        }
        try (FileChannel dirChannel = FileChannel.open(dir, StandardOpenOption.READ)) {
            dirChannel.force(true);
        } catch (IOException e) {
            log.debug("Cannot sync directory {}: {}", dir, e.getMessage());
        }
    }

    private void discardTemp() {
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Cannot delete temp file {}: {}", tempFile, e.getMessage());
        }
    }

    boolean isForcedToDisk() {
        return forced;
    }

    public int getRetained() {
        return retained;
    }

    public int getAppended() {
        synchronized (writeLock) {
            return appended;
        }
    }

    public int getMalformedDropped() {
        return malformedDropped;
    }

    public Path getTempFile() {
        return tempFile;
    }
}
