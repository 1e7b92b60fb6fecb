package com.phillippitts.blast.service.router;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Known category streams of a run. Each category is bound to one file inside the run
 * directory; structured categories are written as one JSON object per line.
 */
public enum LogCategory {
    EVENTS("events", "events.jsonl", true),
    ERRORS("errors", "errors.jsonl", true),
    PERFORMANCE("performance", "performance.jsonl", true),
    SERIAL("serial", "serial.jsonl", true),
    SYSTEM(null, "system.log", false),
    DATA("data", "data.jsonl", true);

    private final String directory;
    private final String fileName;
    private final boolean structured;

    LogCategory(String directory, String fileName, boolean structured) {
        this.directory = directory;
        this.fileName = fileName;
        this.structured = structured;
    }

    /**
     * Resolves this category's file within the given run directory.
     */
    public Path resolve(Path runDirectory) {
        return directory == null
                ? runDirectory.resolve(fileName)
                : runDirectory.resolve(directory).resolve(fileName);
    }

    public boolean isStructured() {
        return structured;
    }

    /** Lowercase name used in record payloads and metric tags. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
