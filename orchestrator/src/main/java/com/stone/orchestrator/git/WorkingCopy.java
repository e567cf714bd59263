package com.stone.orchestrator.git;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * A throwaway clone owned by exactly one resolution attempt.
 *
 * Use it in try-with-resources: {@link #close()} deletes the directory tree
 * on every path out of the block, including exceptions.
 */
public final class WorkingCopy implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkingCopy.class);

    private final Path   directory;
    private final String branch;

    public WorkingCopy(Path directory, String branch) {
        this.directory = directory;
        this.branch    = branch;
    }

    public Path directory() { return directory; }
    public String branch()  { return branch; }

    @Override
    public void close() {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(WorkingCopy::delete);
            log.debug("Removed working copy {}", directory);
        } catch (IOException | UncheckedIOException e) {
            // The attempt itself is already finished; only disk space is lost.
            log.warn("Could not remove working copy {}, manual cleanup may be needed: {}",
                    directory, e.getMessage());
        }
    }

    private static void delete(Path path) {
        try {
            Files.delete(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
