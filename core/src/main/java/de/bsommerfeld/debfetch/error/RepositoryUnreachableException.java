package de.bsommerfeld.debfetch.error;

/**
 * Thrown when a mandatory repository resource cannot be fetched.
 */
public class RepositoryUnreachableException extends PackageDownloadException {

    public RepositoryUnreachableException(String message) {
        super(ErrorKind.REPOSITORY_UNREACHABLE, message);
    }

    public RepositoryUnreachableException(String message, Throwable cause) {
        super(ErrorKind.REPOSITORY_UNREACHABLE, message, cause);
    }
}
