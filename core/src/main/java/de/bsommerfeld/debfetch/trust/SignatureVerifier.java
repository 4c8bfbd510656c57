package de.bsommerfeld.debfetch.trust;

import de.bsommerfeld.debfetch.error.SignatureVerificationException;
import de.bsommerfeld.debfetch.release.FetchedRelease;

/**
 * Decides whether fetched release metadata is authentic. Implementations
 * must only return normally when the signature is both cryptographically
 * valid and made by the key held in the {@link TrustContext}.
 */
public interface SignatureVerifier {

    /**
     * Verifies the release against the context's repository key.
     *
     * @throws SignatureVerificationException if the signature is missing,
     *                                        bad, or made by another key
     */
    void verify(FetchedRelease release, TrustContext context) throws SignatureVerificationException;
}
