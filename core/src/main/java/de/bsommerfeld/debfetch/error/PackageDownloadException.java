package de.bsommerfeld.debfetch.error;

/**
 * Base class for all failures of a package download. Every subclass is
 * terminal for the {@code download()} call that raised it.
 */
public abstract class PackageDownloadException extends Exception {

    private final ErrorKind kind;

    protected PackageDownloadException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PackageDownloadException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
