package de.bsommerfeld.debfetch.api;

import de.bsommerfeld.debfetch.download.Downloader;
import de.bsommerfeld.debfetch.error.InvalidRepositorySpecException;
import de.bsommerfeld.debfetch.error.PackageDownloadException;
import de.bsommerfeld.debfetch.index.IndexLocator;
import de.bsommerfeld.debfetch.index.PackageControlEntry;
import de.bsommerfeld.debfetch.payload.PayloadFetcher;
import de.bsommerfeld.debfetch.release.FetchedRelease;
import de.bsommerfeld.debfetch.release.ReleaseFetcher;
import de.bsommerfeld.debfetch.release.ReleaseMetadata;
import de.bsommerfeld.debfetch.repo.RepositoryDescriptor;
import de.bsommerfeld.debfetch.trust.GpgSignatureVerifier;
import de.bsommerfeld.debfetch.trust.RepositoryKey;
import de.bsommerfeld.debfetch.trust.SignatureVerifier;
import de.bsommerfeld.debfetch.trust.TrustContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Downloads a single binary package from a Debian-style repository and
 * verifies it end to end.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 * 1. Resolve the repository key (if configured) and open a TrustContext
 * 2. Fetch InRelease, or Release (+ Release.gpg when a key is configured)
 * 3. Verify the signature, or warn that the download is unauthenticated
 * 4. Parse the release and locate the package in a checksum-verified index
 * 5. Download the package file and verify its checksum
 * </pre>
 *
 * Data only flows forward. Every failure aborts the call with a subclass
 * of {@link PackageDownloadException}; the trust context is removed on every
 * exit path.
 *
 * <h3>Thread safety</h3>
 * Instances hold only immutable configuration. Concurrent downloads share
 * nothing and each performs its own complete fetch; nothing is cached
 * between calls.
 */
public final class PackageDownloader {

    private static final Logger LOG = LoggerFactory.getLogger(PackageDownloader.class);

    private final RepositoryDescriptor repository;
    private final String repositoryKey;
    private final List<String> architectures;
    private final Downloader downloader;
    private final SignatureVerifier signatureVerifier;
    private final ReleaseFetcher releaseFetcher;
    private final IndexLocator indexLocator;
    private final PayloadFetcher payloadFetcher;

    /**
     * @param repository    parsed repository descriptor
     * @param repositoryKey key reference (URL, file or armored key), or
     *                      {@code null} to skip signature verification
     * @param architectures architectures whose indices are searched, in order
     * @throws InvalidRepositorySpecException if {@code architectures} is empty
     */
    public PackageDownloader(RepositoryDescriptor repository, String repositoryKey, List<String> architectures,
            Downloader downloader, SignatureVerifier signatureVerifier) throws InvalidRepositorySpecException {
        if (architectures == null || architectures.isEmpty() || architectures.stream().anyMatch(String::isBlank)) {
            throw new InvalidRepositorySpecException("Missing (non empty) list of architectures");
        }
        this.repository = repository;
        this.repositoryKey = repositoryKey == null || repositoryKey.isBlank() ? null : repositoryKey;
        this.architectures = List.copyOf(architectures);
        this.downloader = downloader;
        this.signatureVerifier = signatureVerifier;
        this.releaseFetcher = new ReleaseFetcher(downloader);
        this.indexLocator = new IndexLocator(downloader);
        this.payloadFetcher = new PayloadFetcher(downloader);
    }

    /**
     * Creates a downloader with the default transport and a {@code gpg} from
     * the {@code PATH}.
     */
    public static PackageDownloader create(String repositorySpec, String repositoryKey, List<String> architectures)
            throws InvalidRepositorySpecException {
        return new PackageDownloader(RepositoryDescriptor.parse(repositorySpec), repositoryKey, architectures,
                new Downloader(), new GpgSignatureVerifier());
    }

    /**
     * Runs the full pipeline for one package.
     *
     * @param packageName exact value of the package's {@code Package} field
     * @param destination directory the package file is written to; created
     *                    if missing
     * @return absolute path of the verified package file
     * @throws PackageDownloadException on any failure; its
     *                                  {@link PackageDownloadException#kind()}
     *                                  names the failing stage
     */
    public Path download(String packageName, Path destination) throws PackageDownloadException {
        if (packageName == null || packageName.isBlank()) {
            throw new IllegalArgumentException("Missing package name");
        }

        RepositoryKey key = repositoryKey == null ? null : RepositoryKey.resolve(repositoryKey, downloader);

        try (TrustContext context = openContext(key)) {
            FetchedRelease release = releaseFetcher.fetch(repository, key != null);

            if (key != null) {
                signatureVerifier.verify(release, context);
            } else {
                LOG.warn("Package {} will get downloaded without verification! No repository key configured for {}",
                        packageName, repository.baseUri());
            }

            ReleaseMetadata metadata = ReleaseMetadata.parse(release);
            PackageControlEntry entry = indexLocator.locate(repository, metadata, architectures, packageName);
            return payloadFetcher.fetch(repository, entry, destination);
        }
    }

    public RepositoryDescriptor repository() {
        return repository;
    }

    public List<String> architectures() {
        return architectures;
    }

    private static TrustContext openContext(RepositoryKey key) {
        try {
            return TrustContext.open(key);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to create temporary working directory", e);
        }
    }
}
