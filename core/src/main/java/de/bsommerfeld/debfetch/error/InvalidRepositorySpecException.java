package de.bsommerfeld.debfetch.error;

/**
 * Thrown when a repository specification line or the architecture list is unusable.
 */
public class InvalidRepositorySpecException extends PackageDownloadException {

    public InvalidRepositorySpecException(String message) {
        super(ErrorKind.INVALID_REPOSITORY_SPEC, message);
    }

    public InvalidRepositorySpecException(String message, Throwable cause) {
        super(ErrorKind.INVALID_REPOSITORY_SPEC, message, cause);
    }
}
