package de.bsommerfeld.debfetch.hash;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hex digest utility. Uses streaming I/O for files so large payloads are
 * never loaded into memory.
 */
public final class HashUtil {

    private static final int BUFFER_SIZE = 8192;

    private HashUtil() {}

    /**
     * Computes the lower-case hex digest of the given file.
     *
     * @throws IOException if the file cannot be read
     */
    public static String digest(ChecksumAlgorithm algorithm, Path file) throws IOException {
        MessageDigest digest = newDigest(algorithm);
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /** Computes the lower-case hex digest of an in-memory buffer. */
    public static String digest(ChecksumAlgorithm algorithm, byte[] data) {
        MessageDigest digest = newDigest(algorithm);
        digest.update(data);
        return HexFormat.of().formatHex(digest.digest());
    }

    /** Case-insensitive comparison, repositories are not consistent about hex case. */
    public static boolean matches(String expected, String actual) {
        return expected != null && expected.strip().equalsIgnoreCase(actual);
    }

    private static MessageDigest newDigest(ChecksumAlgorithm algorithm) {
        try {
            return MessageDigest.getInstance(algorithm.digestName());
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 and SHA-512 are mandated by the JVM spec
            throw new AssertionError(algorithm.digestName() + " not available", e);
        }
    }
}
