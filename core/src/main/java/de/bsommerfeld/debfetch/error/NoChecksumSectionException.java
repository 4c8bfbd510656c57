package de.bsommerfeld.debfetch.error;

/**
 * Thrown when neither a SHA512 nor a SHA256 checksum is available for a resource.
 */
public class NoChecksumSectionException extends PackageDownloadException {

    public NoChecksumSectionException(String message) {
        super(ErrorKind.NO_CHECKSUM_SECTION, message);
    }

    public NoChecksumSectionException(String message, Throwable cause) {
        super(ErrorKind.NO_CHECKSUM_SECTION, message, cause);
    }
}
