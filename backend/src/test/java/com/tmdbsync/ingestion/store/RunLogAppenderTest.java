package com.tmdbsync.ingestion.store;

import com.tmdbsync.domain.SyncRunSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

class RunLogAppenderTest {

    private static final LocalDate DATE = LocalDate.of(2026, 10, 17);

    @TempDir
    Path dir;

    @Test
    void format_withoutErrors() {
        SyncRunSummary summary = new SyncRunSummary("movie_details", 3, 1, 116, 120, Map.of(), 0);

        assertThat(RunLogAppender.format(summary, DATE))
                .isEqualTo("17/10/2026 : added 3 movie_details / updated 1 movie_details / errors 0 / total : 120");
    }

    @Test
    void format_withErrorBreakdown() {
        Map<String, Integer> errors = new TreeMap<>(Map.of("HTTP_404", 2, "HTTP_429_exceeded_retries", 1));
        SyncRunSummary summary = new SyncRunSummary("people_details", 0, 0, 10, 10, errors, 0);

        assertThat(RunLogAppender.format(summary, DATE)).isEqualTo(
                "17/10/2026 : added 0 people_details / updated 0 people_details / errors 3"
                        + " / HTTP_404=2 ; HTTP_429_exceeded_retries=1 / total : 10");
    }

    @Test
    void append_accumulatesOneLinePerRun() throws Exception {
        RunLogAppender appender = new RunLogAppender(dir.resolve("logs/fetch_tmdb"));
        appender.append(new SyncRunSummary("ref_languages", 5, 0, 0, 5, Map.of(), 0), DATE);
        appender.append(new SyncRunSummary("ref_languages", 0, 5, 0, 5, Map.of(), 0), DATE.plusDays(1));

        assertThat(Files.readAllLines(appender.logFileFor("ref_languages"))).hasSize(2);
    }
}
