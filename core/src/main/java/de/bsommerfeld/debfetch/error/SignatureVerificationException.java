package de.bsommerfeld.debfetch.error;

/**
 * Thrown when the release metadata is not signed by the configured repository key.
 */
public class SignatureVerificationException extends PackageDownloadException {

    public SignatureVerificationException(String message) {
        super(ErrorKind.SIGNATURE_VERIFICATION_FAILED, message);
    }

    public SignatureVerificationException(String message, Throwable cause) {
        super(ErrorKind.SIGNATURE_VERIFICATION_FAILED, message, cause);
    }
}
