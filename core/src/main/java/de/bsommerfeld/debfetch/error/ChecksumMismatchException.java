package de.bsommerfeld.debfetch.error;

/**
 * Thrown when downloaded bytes do not hash to the digest recorded for them.
 * Carries the resource location and both digests for diagnostics.
 */
public class ChecksumMismatchException extends PackageDownloadException {

    private final String location;
    private final String expected;
    private final String actual;

    public ChecksumMismatchException(String location, String algorithm, String expected, String actual) {
        super(ErrorKind.CHECKSUM_MISMATCH,
                algorithm + " mismatch for " + location + ": expected " + expected + ", got " + actual);
        this.location = location;
        this.expected = expected;
        this.actual = actual;
    }

    public String location() {
        return location;
    }

    public String expected() {
        return expected;
    }

    public String actual() {
        return actual;
    }
}
