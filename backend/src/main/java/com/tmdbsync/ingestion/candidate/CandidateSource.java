package com.tmdbsync.ingestion.candidate;

import com.tmdbsync.domain.Candidate;

import java.util.List;

/**
 * Supplies the keys an incremental entity should contain, deduplicated, in first-seen order.
 */
@FunctionalInterface
public interface CandidateSource {

    List<Candidate> candidates();
}
