package de.bsommerfeld.debfetch.release;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Raw repository metadata as fetched, before any trust decision.
 *
 * @param content            the InRelease or Release document
 * @param inlineSigned       {@code true} when {@code content} is a clear-signed
 *                           InRelease document
 * @param detachedSignature  the Release.gpg signature, present only for the
 *                           Release path with a configured key
 * @param sourceUrl          where {@code content} was fetched from
 */
public record FetchedRelease(byte[] content, boolean inlineSigned, Optional<byte[]> detachedSignature,
        String sourceUrl) {

    /** Canonical file name of the document, as gpg and APT expect it. */
    public String fileName() {
        return inlineSigned ? "InRelease" : "Release";
    }

    public String contentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
