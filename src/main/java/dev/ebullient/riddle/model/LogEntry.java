package dev.ebullient.riddle.model;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/** One line of the campaign's narrative log. Importance: minor, standard or critical. */
public record LogEntry(
        String id,
        Instant timestamp,
        String entry,
        String importance) {

    public static final String MINOR = "minor";
    public static final String STANDARD = "standard";
    public static final String CRITICAL = "critical";
    public static final Set<String> IMPORTANCE = Set.of(MINOR, STANDARD, CRITICAL);

    public LogEntry {
        if (entry == null || entry.isBlank()) {
            throw new IllegalArgumentException("Log entry text is required");
        }
        if (importance == null || importance.isBlank()) {
            importance = STANDARD;
        }
        if (!IMPORTANCE.contains(importance)) {
            throw new IllegalArgumentException("Unknown importance: " + importance + " (expected one of " + IMPORTANCE + ")");
        }
    }

    public static LogEntry of(String entry, String importance) {
        return new LogEntry(UUID.randomUUID().toString(), Instant.now(), entry.trim(),
                importance == null ? null : importance.trim().toLowerCase());
    }
}
