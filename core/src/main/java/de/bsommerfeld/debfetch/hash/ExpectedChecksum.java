package de.bsommerfeld.debfetch.hash;

import de.bsommerfeld.debfetch.error.ChecksumMismatchException;
import de.bsommerfeld.debfetch.util.Candidates;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * A digest that some downloaded content must hash to.
 *
 * @param algorithm algorithm the digest was computed with
 * @param digest    hex digest as published by the repository
 */
public record ExpectedChecksum(ChecksumAlgorithm algorithm, String digest) {

    /**
     * Picks the strongest checksum present in a set of control fields,
     * accepting both spellings of each field name.
     */
    public static Optional<ExpectedChecksum> strongestOf(Map<String, String> fields) {
        return Candidates.selectFirstAvailable(ChecksumAlgorithm.preferenceOrder(),
                algorithm -> algorithm.lookup(fields).map(digest -> new ExpectedChecksum(algorithm, digest)));
    }

    /**
     * @param location URL or path reported in the exception
     * @throws ChecksumMismatchException if the data does not match
     */
    public void verify(byte[] data, String location) throws ChecksumMismatchException {
        check(HashUtil.digest(algorithm, data), location);
    }

    /**
     * @param location URL or path reported in the exception
     * @throws ChecksumMismatchException if the file does not match
     */
    public void verify(Path file, String location) throws ChecksumMismatchException, IOException {
        check(HashUtil.digest(algorithm, file), location);
    }

    private void check(String actual, String location) throws ChecksumMismatchException {
        if (!HashUtil.matches(digest, actual)) {
            throw new ChecksumMismatchException(location, algorithm.sectionName(), digest, actual);
        }
    }
}
