package de.bsommerfeld.debfetch.error;

/**
 * Classification of every way a package download can fail. Callers switch
 * on the kind to decide whether to abort the program or report and continue.
 */
public enum ErrorKind {

    /** The repository line or the architecture list could not be parsed. */
    INVALID_REPOSITORY_SPEC,

    /** A mandatory fetch failed (network error or non-2xx status). */
    REPOSITORY_UNREACHABLE,

    /** The repository metadata signature did not verify against the key. */
    SIGNATURE_VERIFICATION_FAILED,

    /** Neither a SHA512 nor a SHA256 checksum is available. */
    NO_CHECKSUM_SECTION,

    /** Downloaded bytes do not match the recorded digest. */
    CHECKSUM_MISMATCH,

    /** No index consulted contains the requested package. */
    PACKAGE_NOT_FOUND
}
