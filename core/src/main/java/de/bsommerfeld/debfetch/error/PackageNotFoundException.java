package de.bsommerfeld.debfetch.error;

/**
 * Thrown when no candidate index contains the requested package.
 */
public class PackageNotFoundException extends PackageDownloadException {

    public PackageNotFoundException(String message) {
        super(ErrorKind.PACKAGE_NOT_FOUND, message);
    }

    public PackageNotFoundException(String message, Throwable cause) {
        super(ErrorKind.PACKAGE_NOT_FOUND, message, cause);
    }
}
