package de.bsommerfeld.debfetch.launcher;

import com.google.inject.Singleton;
import de.bsommerfeld.debfetch.api.PackageDownloader;
import de.bsommerfeld.debfetch.download.Downloader;
import de.bsommerfeld.debfetch.error.InvalidRepositorySpecException;
import de.bsommerfeld.debfetch.repo.RepositoryDescriptor;
import de.bsommerfeld.debfetch.trust.SignatureVerifier;
import jakarta.inject.Inject;

import java.util.List;

/**
 * Creates {@link PackageDownloader} instances that share the injected
 * transport and verifier.
 */
@Singleton
public class PackageDownloaderFactory {

    private final Downloader downloader;
    private final SignatureVerifier signatureVerifier;

    @Inject
    public PackageDownloaderFactory(Downloader downloader, SignatureVerifier signatureVerifier) {
        this.downloader = downloader;
        this.signatureVerifier = signatureVerifier;
    }

    public PackageDownloader create(String repositorySpec, String repositoryKey, List<String> architectures)
            throws InvalidRepositorySpecException {
        return new PackageDownloader(RepositoryDescriptor.parse(repositorySpec), repositoryKey, architectures,
                downloader, signatureVerifier);
    }
}
