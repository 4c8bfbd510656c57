package de.bsommerfeld.debfetch.release;

import de.bsommerfeld.debfetch.download.Downloader;
import de.bsommerfeld.debfetch.error.RepositoryUnreachableException;
import de.bsommerfeld.debfetch.repo.RepositoryDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Retrieves the release metadata of a repository distribution.
 *
 * <h3>Fetch order</h3>
 * <pre>
 * 1. dists/&lt;dist&gt;/InRelease    optional, inline-signed, wins when present
 * 2. dists/&lt;dist&gt;/Release      mandatory if InRelease is absent
 * 3. dists/&lt;dist&gt;/Release.gpg  mandatory only if a repository key is configured
 * </pre>
 * Any failure on the optional InRelease fetch falls through to step 2.
 * Failures on mandatory fetches raise {@link RepositoryUnreachableException}.
 */
public class ReleaseFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(ReleaseFetcher.class);

    private final Downloader downloader;

    public ReleaseFetcher(Downloader downloader) {
        this.downloader = downloader;
    }

    /**
     * @param repository      the repository to query
     * @param signatureNeeded whether the detached signature must be fetched
     *                        on the Release path
     */
    public FetchedRelease fetch(RepositoryDescriptor repository, boolean signatureNeeded)
            throws RepositoryUnreachableException {
        String inReleaseUrl = repository.distributionFileUrl("InRelease");
        Optional<byte[]> inRelease = tryFetchOptional(inReleaseUrl);
        if (inRelease.isPresent()) {
            LOG.info("Using inline-signed release metadata from {}", inReleaseUrl);
            return new FetchedRelease(inRelease.get(), true, Optional.empty(), inReleaseUrl);
        }

        String releaseUrl = repository.distributionFileUrl("Release");
        LOG.info("No InRelease available, falling back to {}", releaseUrl);
        byte[] release = fetchMandatory(releaseUrl);

        Optional<byte[]> signature = Optional.empty();
        if (signatureNeeded) {
            signature = Optional.of(fetchMandatory(repository.distributionFileUrl("Release.gpg")));
        }
        return new FetchedRelease(release, false, signature, releaseUrl);
    }

    private Optional<byte[]> tryFetchOptional(String url) {
        try {
            return downloader.tryToBytes(url);
        } catch (IOException e) {
            LOG.debug("Optional fetch of {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private byte[] fetchMandatory(String url) throws RepositoryUnreachableException {
        try {
            return downloader.toBytes(url);
        } catch (IOException e) {
            throw new RepositoryUnreachableException("Unable to fetch archive element '" + url + "'", e);
        }
    }
}
