package com.tmdbsync.ingestion.catalog;

import java.util.List;

/**
 * Supplies the requests a full rebuild issues, resolved at run time so they can depend on earlier stores.
 */
@FunctionalInterface
public interface RebuildCallSource {

    List<RebuildCall> calls();
}
