package com.phillippitts.blast.service.router;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * One process lifetime's logging session. Immutable once created.
 *
 * @param id timestamp-derived identifier, e.g. {@code run_20250101_120000}
 * @param directory run directory holding all category streams
 * @param startedAt creation time
 */
public record Run(String id, Path directory, Instant startedAt) {

    public Run {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(startedAt, "startedAt");
    }

    public Path fileFor(LogCategory category) {
        return category.resolve(directory);
    }
}
