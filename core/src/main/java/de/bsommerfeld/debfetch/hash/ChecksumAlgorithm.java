package de.bsommerfeld.debfetch.hash;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checksum algorithms accepted for repository content, strongest first.
 *
 * <p>
 * The declaration order is the preference order. Each constant carries the
 * field names under which repositories publish it: the upper-case spelling
 * used by Release files and modern Packages indices, and the lower-case
 * spelling some older indices emit. Weaker digests (MD5, SHA-1) are
 * deliberately absent and can never satisfy a checksum requirement.
 */
public enum ChecksumAlgorithm {

    SHA512("SHA-512", "SHA512", "sha512"),
    SHA256("SHA-256", "SHA256", "sha256");

    private static final List<ChecksumAlgorithm> PREFERENCE = List.of(values());

    private final String digestName;
    private final List<String> fieldNames;

    ChecksumAlgorithm(String digestName, String... fieldNames) {
        this.digestName = digestName;
        this.fieldNames = List.of(fieldNames);
    }

    /** Algorithms in preference order. */
    public static List<ChecksumAlgorithm> preferenceOrder() {
        return PREFERENCE;
    }

    /** {@link java.security.MessageDigest} name, e.g. {@code SHA-512}. */
    public String digestName() {
        return digestName;
    }

    /** Canonical field name as it appears in a Release file. */
    public String sectionName() {
        return fieldNames.get(0);
    }

    public List<String> fieldNames() {
        return fieldNames;
    }

    /**
     * Returns the value of the first of this algorithm's field spellings that
     * is present and non-blank in the given fields.
     */
    public Optional<String> lookup(Map<String, String> fields) {
        for (String name : fieldNames) {
            String value = fields.get(name);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.strip());
            }
        }
        return Optional.empty();
    }
}
