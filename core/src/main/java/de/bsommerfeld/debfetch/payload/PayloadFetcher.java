package de.bsommerfeld.debfetch.payload;

import de.bsommerfeld.debfetch.download.Downloader;
import de.bsommerfeld.debfetch.error.ChecksumMismatchException;
import de.bsommerfeld.debfetch.error.NoChecksumSectionException;
import de.bsommerfeld.debfetch.error.PackageNotFoundException;
import de.bsommerfeld.debfetch.error.RepositoryUnreachableException;
import de.bsommerfeld.debfetch.hash.ExpectedChecksum;
import de.bsommerfeld.debfetch.index.PackageControlEntry;
import de.bsommerfeld.debfetch.repo.RepositoryDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Downloads and verifies the package file a control entry points to.
 *
 * <p>
 * The checksum is taken from the entry itself, strongest first
 * (SHA512, then SHA256). Entries that only carry {@code MD5sum} or
 * {@code SHA1} are refused.
 *
 * <p>
 * The payload is written to a uniquely named {@code .partial} file in the
 * destination directory and only renamed to its final name once the
 * checksum matches. A failed download removes its partial file and leaves
 * any existing file under the final name untouched.
 */
public class PayloadFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(PayloadFetcher.class);

    private final Downloader downloader;

    public PayloadFetcher(Downloader downloader) {
        this.downloader = downloader;
    }

    /**
     * @return absolute path of the verified package file
     */
    public Path fetch(RepositoryDescriptor repository, PackageControlEntry entry, Path destination)
            throws PackageNotFoundException, NoChecksumSectionException, RepositoryUnreachableException,
            ChecksumMismatchException {
        String filename = entry.filename().orElseThrow(() -> new PackageNotFoundException(
                "Index entry for " + entry.packageName() + " in " + entry.indexPath() + " has no Filename"));
        ExpectedChecksum checksum = entry.checksum().orElseThrow(() -> new NoChecksumSectionException(
                "No SHA512 or SHA256 checksum found for " + entry.packageName() + " (" + filename + ")"));

        String basename = basename(filename);
        if (basename.isEmpty() || basename.equals(".") || basename.equals("..")) {
            throw new PackageNotFoundException("Invalid Filename '" + filename + "' for " + entry.packageName());
        }

        String url = repository.poolUrl(filename);
        Path directory = destination.toAbsolutePath().normalize();
        Path target = directory.resolve(basename);

        LOG.info("Downloading {} {} from {}", entry.packageName(), entry.version().orElse(""), url);
        Path partial = null;
        try {
            try {
                Files.createDirectories(directory);
                partial = Files.createTempFile(directory, basename + ".", ".partial");
                downloader.toFile(url, partial);
            } catch (IOException e) {
                throw new RepositoryUnreachableException("Unable to fetch archive element '" + url + "'", e);
            }

            try {
                checksum.verify(partial, url);
            } catch (IOException e) {
                throw new RepositoryUnreachableException("Unable to read downloaded file " + partial, e);
            }

            try {
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new RepositoryUnreachableException("Unable to store verified file " + target, e);
            }
        } finally {
            if (partial != null) {
                deleteQuietly(partial);
            }
        }

        LOG.info("Verified {} ({} {})", target, checksum.algorithm().sectionName(), checksum.digest());
        return target;
    }

    static String basename(String filename) {
        int slash = filename.lastIndexOf('/');
        return slash >= 0 ? filename.substring(slash + 1) : filename;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Unable to delete partial file {}: {}", file, e.getMessage());
        }
    }
}
