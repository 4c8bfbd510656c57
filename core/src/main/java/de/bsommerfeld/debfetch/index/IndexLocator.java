package de.bsommerfeld.debfetch.index;

import de.bsommerfeld.debfetch.control.ControlFileReader;
import de.bsommerfeld.debfetch.download.Downloader;
import de.bsommerfeld.debfetch.error.ChecksumMismatchException;
import de.bsommerfeld.debfetch.error.NoChecksumSectionException;
import de.bsommerfeld.debfetch.error.PackageNotFoundException;
import de.bsommerfeld.debfetch.error.RepositoryUnreachableException;
import de.bsommerfeld.debfetch.hash.ChecksumAlgorithm;
import de.bsommerfeld.debfetch.hash.ExpectedChecksum;
import de.bsommerfeld.debfetch.release.IndexFileEntry;
import de.bsommerfeld.debfetch.release.ReleaseMetadata;
import de.bsommerfeld.debfetch.repo.RepositoryDescriptor;
import de.bsommerfeld.debfetch.util.Candidates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the control entry of a package in the indices a release vouches for.
 *
 * <h3>Candidate order</h3>
 * For every component, then every architecture, in declared order, the
 * index prefix {@code <component>/binary-<arch>/Packages} is tried with the
 * compressions of {@link CompressionFormat} in preference order. Only
 * variants listed in the release's checksum section are requested. The
 * first variant that downloads wins; the other compressions of the same
 * prefix are not fetched.
 *
 * <h3>Failure policy</h3>
 * <ul>
 * <li>a variant answering with a non-2xx status is skipped</li>
 * <li>a transport error is fatal</li>
 * <li>a checksum mismatch is fatal, a corrupt index is never scanned</li>
 * </ul>
 * Scanning stops at the first paragraph whose {@code Package} field equals
 * the requested name; later indices are not consulted.
 */
public class IndexLocator {

    private static final Logger LOG = LoggerFactory.getLogger(IndexLocator.class);

    private final Downloader downloader;

    public IndexLocator(Downloader downloader) {
        this.downloader = downloader;
    }

    public PackageControlEntry locate(RepositoryDescriptor repository, ReleaseMetadata release,
            List<String> architectures, String packageName)
            throws NoChecksumSectionException, RepositoryUnreachableException, ChecksumMismatchException,
            PackageNotFoundException {
        ChecksumAlgorithm algorithm = release.selectAlgorithm();
        LOG.debug("Using {} checksums from release metadata", algorithm.sectionName());

        List<String> scanned = new ArrayList<>();
        for (String component : repository.components()) {
            for (String architecture : architectures) {
                String prefix = component + "/binary-" + architecture + "/Packages";

                Optional<FetchedIndex> index = Candidates.selectFirstAvailable(
                        CompressionFormat.preferenceOrder(),
                        format -> fetchVariant(repository, release, algorithm, prefix, format));
                if (index.isEmpty()) {
                    LOG.debug("No index available for {}", prefix);
                    continue;
                }

                FetchedIndex fetched = index.get();
                new ExpectedChecksum(algorithm, fetched.entry().checksum())
                        .verify(fetched.data(), fetched.url());
                scanned.add(fetched.entry().relativePath());

                Optional<PackageControlEntry> match = scan(fetched, packageName);
                if (match.isPresent()) {
                    LOG.info("Found package {} in {}", packageName, fetched.entry().relativePath());
                    return match.get();
                }
            }
        }

        throw new PackageNotFoundException("Package " + packageName + " not found"
                + (scanned.isEmpty() ? " (no index files available)" : " in " + String.join(", ", scanned)));
    }

    /**
     * Fetches one compression variant of an index, or returns empty if the
     * release does not list it or the server does not have it.
     */
    private Optional<FetchedIndex> fetchVariant(RepositoryDescriptor repository, ReleaseMetadata release,
            ChecksumAlgorithm algorithm, String prefix, CompressionFormat format)
            throws RepositoryUnreachableException {
        Optional<IndexFileEntry> entry = release.find(algorithm, format.apply(prefix));
        if (entry.isEmpty()) {
            return Optional.empty();
        }

        String url = repository.distributionFileUrl(entry.get().relativePath());
        try {
            return downloader.tryToBytes(url)
                    .map(data -> new FetchedIndex(entry.get(), format, url, data));
        } catch (IOException e) {
            throw new RepositoryUnreachableException("Unable to fetch index '" + url + "'", e);
        }
    }

    /** Streams the decompressed index and returns the first matching paragraph. */
    private Optional<PackageControlEntry> scan(FetchedIndex index, String packageName)
            throws RepositoryUnreachableException {
        try (InputStream decompressed = index.format().decompress(new ByteArrayInputStream(index.data()));
                ControlFileReader reader = new ControlFileReader(decompressed)) {
            return reader.findFirst(p -> p.get("Package").map(packageName::equals).orElse(false))
                    .map(paragraph -> new PackageControlEntry(paragraph, index.entry().relativePath()));
        } catch (IOException e) {
            throw new RepositoryUnreachableException("Unable to read index '" + index.url() + "': " + e.getMessage(), e);
        }
    }

    private record FetchedIndex(IndexFileEntry entry, CompressionFormat format, String url, byte[] data) {}
}
