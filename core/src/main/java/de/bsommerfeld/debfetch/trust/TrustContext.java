package de.bsommerfeld.debfetch.trust;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scratch area for one download: the optional repository key plus a private
 * temporary directory holding the keyring, the fetched metadata and the
 * detached signature.
 *
 * <p>
 * Always used in try-with-resources. {@link #close()} removes the whole
 * directory, so no trust material outlives the download, whether it
 * succeeded or failed.
 */
public final class TrustContext implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TrustContext.class);

    private static final String KEYRING_NAME = "trusted.gpg";

    private final Path directory;
    private final RepositoryKey key;

    private TrustContext(Path directory, RepositoryKey key) {
        this.directory = directory;
        this.key = key;
    }

    /**
     * Creates a fresh context directory, readable only by the current user
     * where the filesystem supports POSIX permissions.
     *
     * @param key the repository key, or {@code null} for unauthenticated use
     */
    public static TrustContext open(RepositoryKey key) throws IOException {
        Path directory;
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            directory = Files.createTempDirectory("debfetch-",
                    PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
        } else {
            directory = Files.createTempDirectory("debfetch-");
        }
        LOG.debug("Opened trust context {}", directory);
        return new TrustContext(directory, key);
    }

    public Path directory() {
        return directory;
    }

    public Optional<RepositoryKey> key() {
        return Optional.ofNullable(key);
    }

    /** Path of the isolated keyring; the file exists only after import. */
    public Path keyring() {
        return directory.resolve(KEYRING_NAME);
    }

    /** Writes a file into the context directory and returns its path. */
    public Path write(String fileName, byte[] content) throws IOException {
        Path target = directory.resolve(fileName);
        Files.write(target, content);
        return target;
    }

    /**
     * Recursively deletes the context directory. Failures are logged rather
     * than thrown so they never mask the outcome of the download itself.
     */
    @Override
    public void close() {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path path : paths) {
                Files.deleteIfExists(path);
            }
            LOG.debug("Removed trust context {}", directory);
        } catch (IOException e) {
            LOG.warn("Failed to remove trust context {}: {}", directory, e.getMessage());
        }
    }
}
