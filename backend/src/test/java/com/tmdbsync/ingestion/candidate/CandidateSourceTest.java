package com.tmdbsync.ingestion.candidate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tmdbsync.domain.Candidate;
import com.tmdbsync.domain.IdentityKey;
import com.tmdbsync.domain.KeySchema;
import com.tmdbsync.ingestion.store.NdjsonCodec;
import com.tmdbsync.ingestion.store.StoreAccessException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateSourceTest {

    @TempDir
    Path dir;

    private final NdjsonCodec codec = new NdjsonCodec(new ObjectMapper());

    @Test
    void storeKeyListing_dedupesInFirstSeenOrder() throws Exception {
        Path dump = Files.writeString(dir.resolve("movie_dumps.json"), String.join("\n",
                "{\"id\":3,\"original_title\":\"c\"}",
                "{\"id\":1}",
                "{\"id\":3}",
                "broken",
                "{\"id\":\"\"}",
                "{\"id\":2}"));

        List<Candidate> candidates = new StoreKeyListing(codec, dump, KeySchema.of("id")).candidates();

        assertThat(candidates).extracting(Candidate::key)
                .containsExactly(IdentityKey.of(3), IdentityKey.of(1), IdentityKey.of(2));
    }

    @Test
    void storeKeyListing_missingFile_failsTheRun() {
        StoreKeyListing listing = new StoreKeyListing(codec, dir.resolve("absent.json"), KeySchema.of("id"));

        assertThatThrownBy(listing::candidates).isInstanceOf(StoreAccessException.class);
    }

    @Test
    void nestedKeyListing_readsSeasonNumbersFromSeries() throws Exception {
        Path series = Files.writeString(dir.resolve("tv_series_details.ndjson"), String.join("\n",
                "{\"id\":1399,\"seasons_index\":[{\"season_number\":0,\"id\":10},{\"season_number\":1,\"id\":11}]}",
                "{\"id\":7,\"seasons_index\":[]}",
                "{\"id\":8}",
                "{\"id\":9,\"seasons_index\":[{\"season_number\":\"x\"},{\"season_number\":2,\"id\":90}]}"));

        List<Candidate> candidates = new NestedKeyListing(codec, series, "id", "seasons_index", "season_number")
                .candidates();

        assertThat(candidates).extracting(Candidate::key).containsExactly(
                IdentityKey.of(1399, 0), IdentityKey.of(1399, 1), IdentityKey.of(9, 2));
    }

    @Test
    void sequenceDerivation_expandsCountsAndCarriesParentDate() throws Exception {
        Path seasons = Files.writeString(dir.resolve("tv_seasons_details.ndjson"), String.join("\n",
                "{\"series_id\":1399,\"season_number\":1,\"episode_count\":3,\"air_date\":\"2026-09-01\"}",
                "{\"series_id\":1399,\"season_number\":2,\"episode_count\":0,\"air_date\":\"2026-10-01\"}",
                "{\"series_id\":50,\"season_number\":1,\"episode_count\":1}",
                "{\"series_id\":51,\"season_number\":1}"));

        List<Candidate> candidates = new SequenceDerivation(codec, seasons,
                KeySchema.of("series_id", "season_number"), "episode_count", "air_date").candidates();

        assertThat(candidates).extracting(Candidate::key).containsExactly(
                IdentityKey.of(1399, 1, 1), IdentityKey.of(1399, 1, 2), IdentityKey.of(1399, 1, 3),
                IdentityKey.of(50, 1, 1));
        assertThat(candidates.get(0).parentDate()).isEqualTo(LocalDate.of(2026, 9, 1));
        assertThat(candidates.get(3).parentDate()).isNull();
    }
}
