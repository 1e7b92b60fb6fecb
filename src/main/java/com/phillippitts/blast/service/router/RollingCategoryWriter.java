package com.phillippitts.blast.service.router;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Append-only line writer for one category file with size-based rotation.
 *
 * <p>When appending a line would push the file past {@code maxBytes}, the file is rotated
 * to {@code name.1}, older backups shift up by one and anything beyond {@code backupCount}
 * is discarded. Not thread-safe: only the router consumer thread touches it.
 */
final class RollingCategoryWriter implements Closeable {

    private final Path file;
    private final long maxBytes;
    private final int backupCount;
    private BufferedWriter writer;
    private long size;

    RollingCategoryWriter(Path file, long maxBytes, int backupCount) throws IOException {
        this.file = file;
        this.maxBytes = maxBytes;
        this.backupCount = backupCount;
        open();
    }

    void append(String line) throws IOException {
        long lineBytes = line.getBytes(StandardCharsets.UTF_8).length + 1L;
        if (size > 0 && size + lineBytes > maxBytes) {
            rotate();
        }
        writer.write(line);
        writer.newLine();
        size += lineBytes;
    }

    void flush() throws IOException {
        writer.flush();
    }

    Path file() {
        return file;
    }

    private void open() throws IOException {
        writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        size = Files.size(file);
    }

    private void rotate() throws IOException {
        writer.close();
        if (backupCount > 0) {
            Files.deleteIfExists(backup(backupCount));
            for (int i = backupCount - 1; i >= 1; i--) {
                Path src = backup(i);
                if (Files.exists(src)) {
                    Files.move(src, backup(i + 1), StandardCopyOption.REPLACE_EXISTING);
                }
            }
            Files.move(file, backup(1), StandardCopyOption.REPLACE_EXISTING);
        } else {
            Files.delete(file);
        }
        open();
    }

    private Path backup(int index) {
        return file.resolveSibling(file.getFileName() + "." + index);
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
