package de.bsommerfeld.debfetch.launcher;

import de.bsommerfeld.debfetch.error.ErrorKind;

/**
 * Process exit codes. Each {@link ErrorKind} gets its own code so scripts can
 * tell a missing package from a failed signature check.
 */
final class ExitCodes {

    static final int OK = 0;
    static final int UNEXPECTED = 1;

    private ExitCodes() {
    }

    static int of(ErrorKind kind) {
        return switch (kind) {
            case INVALID_REPOSITORY_SPEC -> 2;
            case REPOSITORY_UNREACHABLE -> 3;
            case SIGNATURE_VERIFICATION_FAILED -> 4;
            case NO_CHECKSUM_SECTION -> 5;
            case CHECKSUM_MISMATCH -> 6;
            case PACKAGE_NOT_FOUND -> 7;
        };
    }
}
