package com.tmdbsync.ingestion.store;

import com.tmdbsync.domain.SyncRunSummary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Appends one summary line per run to the entity's log:
 * {@code 17/10/2026 : added 3 movie_details / updated 1 movie_details / errors 2 / HTTP_404=2 / total : 120}.
 */
public class RunLogAppender {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private final Path logsDir;

    public RunLogAppender(Path logsDir) {
        this.logsDir = logsDir;
    }

    public Path logFileFor(String entity) {
        return logsDir.resolve(entity + ".log");
    }

    public void append(SyncRunSummary summary, LocalDate date) {
        Path logFile = logFileFor(summary.entity());
        String line = format(summary, date) + "\n";
        try {
            Files.createDirectories(logsDir);
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StoreAccessException("Cannot append run log " + logFile, e);
        }
    }

    static String format(SyncRunSummary summary, LocalDate date) {
        String entity = summary.entity();
        return date.format(DATE_FORMAT)
                + " : added " + summary.added() + " " + entity
                + " / updated " + summary.updated() + " " + entity
                + " / " + errorsPart(summary.errors())
                + " / total : " + summary.total();
    }

    private static String errorsPart(Map<String, Integer> errors) {
        int total = errors.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) {
            return "errors 0";
        }
        String detail = errors.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" ; "));
        return "errors " + total + " / " + detail;
    }
}
