package com.phillippitts.blast.service.router;

import com.phillippitts.blast.exception.LogDirectoryException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Allocates run directories under a base directory and keeps the {@code latest} pointer
 * aimed at the newest run.
 *
 * <p>The pointer is a symbolic link where the platform supports it. Otherwise a small
 * {@code latest.path} file holding the absolute run path is written instead.
 *
 * <p>{@link #cleanupOldRuns} removes whole run directories once their newest file has aged
 * past the retention period.
 */
public final class RunDirectoryFactory {

    private static final Logger LOG = LogManager.getLogger(RunDirectoryFactory.class);

    static final String LATEST_LINK = "latest";
    static final String LATEST_POINTER_FILE = "latest.path";
    static final String RUN_PREFIX = "run_";
    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_SUFFIX = 1000;

    private final Path baseDirectory;
    private final Clock clock;

    public RunDirectoryFactory(Path baseDirectory, Clock clock) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a new run directory with one file per {@link LogCategory} and retargets the
     * latest pointer.
     *
     * @return the created run
     * @throws LogDirectoryException if the directory or any category file cannot be created
     */
    public Run createRun() {
        Instant now = clock.instant();
        String baseId = RUN_PREFIX + RUN_ID_FORMAT.format(now.atZone(ZoneId.systemDefault()));
        Path runDir = allocate(baseId);
        for (LogCategory category : LogCategory.values()) {
            Path file = category.resolve(runDir);
            try {
                Files.createDirectories(file.getParent());
                if (!Files.exists(file)) {
                    Files.createFile(file);
                }
            } catch (IOException e) {
                throw new LogDirectoryException(file.toString(), e);
            }
        }
        Run run = new Run(runDir.getFileName().toString(), runDir, now);
        updateLatestPointer(run);
        LOG.info("Created log run {} at {}", run.id(), runDir.toAbsolutePath());
        return run;
    }

    private Path allocate(String baseId) {
        try {
            Files.createDirectories(baseDirectory);
        } catch (IOException e) {
            throw new LogDirectoryException(baseDirectory.toString(), e);
        }
        for (int suffix = 0; suffix < MAX_SUFFIX; suffix++) {
            Path candidate = baseDirectory.resolve(suffix == 0 ? baseId : baseId + "_" + suffix);
            try {
                return Files.createDirectory(candidate);
            } catch (FileAlreadyExistsException e) {
                LOG.debug("Run directory {} exists, trying next suffix", candidate);
            } catch (IOException e) {
                throw new LogDirectoryException(candidate.toString(), e);
            }
        }
        throw new LogDirectoryException(baseDirectory.resolve(baseId).toString(),
                new IOException("Too many runs created within the same second"));
    }

    private void updateLatestPointer(Run run) {
        Path link = baseDirectory.resolve(LATEST_LINK);
        try {
            Files.deleteIfExists(link);
            Files.createSymbolicLink(link, run.directory().getFileName());
            return;
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            LOG.debug("Symlink unsupported for {}, writing pointer file instead: {}", link, e.toString());
        }
        Path pointer = baseDirectory.resolve(LATEST_POINTER_FILE);
        try {
            Files.writeString(pointer, run.directory().toAbsolutePath().toString(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LogDirectoryException(pointer.toString(), e);
        }
    }

    /**
     * Deletes every run directory whose most recently modified file is older than
     * {@code maxAge}. The {@code keep} directory is never touched. A run that cannot be
     * deleted is logged and skipped.
     *
     * @param keep the active run directory (nullable)
     * @return number of runs removed
     * @throws LogDirectoryException if the base directory cannot be listed
     */
    public int cleanupOldRuns(Duration maxAge, Path keep) {
        Objects.requireNonNull(maxAge, "maxAge");
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be >= 0, got " + maxAge);
        }
        if (!Files.isDirectory(baseDirectory)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(maxAge);
        List<Path> candidates = new ArrayList<>();
        try (Stream<Path> entries = Files.list(baseDirectory)) {
            entries.filter(p -> p.getFileName().toString().startsWith(RUN_PREFIX))
                    .filter(p -> Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS))
                    .filter(p -> keep == null || !p.toAbsolutePath().normalize()
                            .equals(keep.toAbsolutePath().normalize()))
                    .forEach(candidates::add);
        } catch (IOException e) {
            throw new LogDirectoryException(baseDirectory.toString(), e);
        }
        int removed = 0;
        for (Path runDir : candidates) {
            try {
                if (newestModification(runDir).isBefore(cutoff)) {
                    deleteTree(runDir);
                    removed++;
                    LOG.info("Removed expired log run {}", runDir.getFileName());
                }
            } catch (IOException e) {
                LOG.warn("Could not remove log run {}: {}", runDir, e.toString());
            }
        }
        return removed;
    }

    private static Instant newestModification(Path runDir) throws IOException {
        try (Stream<Path> tree = Files.walk(runDir)) {
            Instant newest = Instant.MIN;
            for (Path p : (Iterable<Path>) tree::iterator) {
                Instant modified = Files.getLastModifiedTime(p, LinkOption.NOFOLLOW_LINKS).toInstant();
                if (modified.isAfter(newest)) {
                    newest = modified;
                }
            }
            return newest;
        }
    }

    private static void deleteTree(Path runDir) throws IOException {
        List<Path> paths;
        try (Stream<Path> tree = Files.walk(runDir)) {
            paths = tree.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path p : paths) {
            Files.delete(p);
        }
    }
}
