package de.bsommerfeld.debfetch.trust;

import de.bsommerfeld.debfetch.download.Downloader;
import de.bsommerfeld.debfetch.error.RepositoryUnreachableException;
import de.bsommerfeld.debfetch.error.SignatureVerificationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Public key material that repository metadata must be signed with.
 *
 * @param material armored or binary OpenPGP public key data
 * @param origin   where the key came from, for log and error messages
 */
public record RepositoryKey(byte[] material, String origin) {

    private static final String ARMOR_HEADER = "-----BEGIN PGP PUBLIC KEY BLOCK-----";

    /**
     * Resolves a key reference. Accepted forms, checked in this order:
     * <ul>
     * <li>an {@code http://} or {@code https://} URL, which is downloaded</li>
     * <li>an inline ASCII-armored public key block</li>
     * <li>the path of a readable local file</li>
     * </ul>
     *
     * @throws RepositoryUnreachableException if a key URL cannot be fetched
     * @throws SignatureVerificationException if the reference matches none of
     *                                        the accepted forms
     */
    public static RepositoryKey resolve(String reference, Downloader downloader)
            throws RepositoryUnreachableException, SignatureVerificationException {
        String trimmed = reference.strip();
        String lower = trimmed.toLowerCase(Locale.ROOT);

        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            try {
                return new RepositoryKey(downloader.toBytes(trimmed), trimmed);
            } catch (IOException e) {
                throw new RepositoryUnreachableException("Unable to fetch repository key '" + trimmed + "'", e);
            }
        }

        if (trimmed.contains(ARMOR_HEADER)) {
            return new RepositoryKey(trimmed.getBytes(StandardCharsets.US_ASCII), "inline key");
        }

        Path file = asPath(trimmed);
        if (file != null && Files.isRegularFile(file)) {
            try {
                return new RepositoryKey(Files.readAllBytes(file), file.toString());
            } catch (IOException e) {
                throw new SignatureVerificationException("Unable to read repository key file " + file, e);
            }
        }

        throw new SignatureVerificationException(
                "Repository key '" + abbreviate(trimmed) + "' is neither a URL, a readable file nor an armored key");
    }

    private static Path asPath(String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            return null;
        }
    }

    private static String abbreviate(String value) {
        return value.length() <= 60 ? value : value.substring(0, 57) + "...";
    }
}
