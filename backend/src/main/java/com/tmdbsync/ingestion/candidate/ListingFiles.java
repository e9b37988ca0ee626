package com.tmdbsync.ingestion.candidate;

import com.tmdbsync.ingestion.store.StoreAccessException;

import java.nio.file.Files;
import java.nio.file.Path;

final class ListingFiles {

    private ListingFiles() {
    }

    static void requireExists(Path listing) {
        if (!Files.isRegularFile(listing)) {
            throw new StoreAccessException("Listing input not found: " + listing);
        }
    }
}
