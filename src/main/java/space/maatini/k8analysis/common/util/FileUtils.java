package space.maatini.k8analysis.common.util;

import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Local filesystem helpers for the cache and working directories.
 */
public final class FileUtils {

    private static final Logger LOG = Logger.getLogger(FileUtils.class);

    private FileUtils() {
    }

    public static void createParentDirectories(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create parent directory of " + path, e);
        }
    }

    /**
     * Make sure {@code directory} exists and is empty, deleting whatever was there before.
     */
    public static void createOrCleanupDirectory(Path directory) {
        try {
            if (Files.isDirectory(directory)) {
                LOG.debugf("Cleaning up directory %s", directory);
                deleteRecursively(directory);
            } else {
                Files.deleteIfExists(directory);
            }
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create or clean up directory " + directory, e);
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        try (Stream<Path> walk = Files.walk(directory)) {
            for (Path path : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(path);
            }
        }
    }
}
