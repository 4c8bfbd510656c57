package de.bsommerfeld.debfetch.release;

import de.bsommerfeld.debfetch.control.ClearsignedDocument;
import de.bsommerfeld.debfetch.control.ControlFileReader;
import de.bsommerfeld.debfetch.control.ControlParagraph;
import de.bsommerfeld.debfetch.error.NoChecksumSectionException;
import de.bsommerfeld.debfetch.error.SignatureVerificationException;
import de.bsommerfeld.debfetch.hash.ChecksumAlgorithm;
import de.bsommerfeld.debfetch.util.Candidates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed Release document.
 *
 * <p>
 * Holds the top-level fields and, per checksum algorithm, the ordered list
 * of index files the release vouches for. Only algorithms listed in
 * {@link ChecksumAlgorithm} are retained; {@code MD5Sum} and {@code SHA1}
 * sections are ignored.
 *
 * @param fields   single-line top-level fields such as {@code Suite}
 * @param sections checksum sections keyed by algorithm
 */
public record ReleaseMetadata(Map<String, String> fields, Map<ChecksumAlgorithm, List<IndexFileEntry>> sections) {

    private static final Logger LOG = LoggerFactory.getLogger(ReleaseMetadata.class);

    public ReleaseMetadata {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        EnumMap<ChecksumAlgorithm, List<IndexFileEntry>> copy = new EnumMap<>(ChecksumAlgorithm.class);
        sections.forEach((algorithm, entries) -> copy.put(algorithm, List.copyOf(entries)));
        sections = Collections.unmodifiableMap(copy);
    }

    /**
     * Parses fetched release metadata. An InRelease document must be exactly
     * one clear-signed block; only its signed text is parsed.
     *
     * @throws SignatureVerificationException if an InRelease document carries
     *                                        text outside its signed block
     */
    public static ReleaseMetadata parse(FetchedRelease release) throws SignatureVerificationException {
        String document = release.contentAsString();
        return parse(release.inlineSigned() ? ClearsignedDocument.signedContent(document) : document);
    }

    /**
     * Parses a plain Release document. Only the first paragraph is
     * considered.
     */
    public static ReleaseMetadata parse(String document) {
        List<ControlParagraph> paragraphs = ControlFileReader.parseAll(document);
        if (paragraphs.isEmpty()) {
            return new ReleaseMetadata(Map.of(), Map.of());
        }
        ControlParagraph main = paragraphs.get(0);

        Map<String, String> fields = new LinkedHashMap<>();
        Map<ChecksumAlgorithm, List<IndexFileEntry>> sections = new EnumMap<>(ChecksumAlgorithm.class);

        main.fields().forEach((name, value) -> {
            Optional<ChecksumAlgorithm> algorithm = algorithmForSection(name);
            if (algorithm.isPresent()) {
                sections.put(algorithm.get(), parseSection(name, value));
            } else if (!value.contains("\n")) {
                fields.put(name, value);
            }
        });
        return new ReleaseMetadata(fields, sections);
    }

    /**
     * Picks the strongest algorithm that has a section in this release. The
     * result is used for the whole run; algorithms are never mixed.
     *
     * @throws NoChecksumSectionException if neither SHA512 nor SHA256 is present
     */
    public ChecksumAlgorithm selectAlgorithm() throws NoChecksumSectionException {
        return Candidates.selectFirstAvailable(ChecksumAlgorithm.preferenceOrder(),
                algorithm -> sections.containsKey(algorithm) ? Optional.of(algorithm) : Optional.empty())
                .orElseThrow(() -> new NoChecksumSectionException(
                        "Neither SHA512 nor SHA256 section found in release file"));
    }

    /** Entries of the given algorithm's section, empty if absent. */
    public List<IndexFileEntry> entries(ChecksumAlgorithm algorithm) {
        return sections.getOrDefault(algorithm, List.of());
    }

    /** Looks up one path in the given algorithm's section. */
    public Optional<IndexFileEntry> find(ChecksumAlgorithm algorithm, String relativePath) {
        return entries(algorithm).stream()
                .filter(e -> e.relativePath().equals(relativePath))
                .findFirst();
    }

    public Optional<String> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    // =====================================================================
    // Parsing helpers
    // =====================================================================

    private static Optional<ChecksumAlgorithm> algorithmForSection(String fieldName) {
        for (ChecksumAlgorithm algorithm : ChecksumAlgorithm.preferenceOrder()) {
            if (algorithm.sectionName().equals(fieldName)) {
                return Optional.of(algorithm);
            }
        }
        return Optional.empty();
    }

    /** Parses {@code <digest> <size> <path>} rows; malformed rows are skipped. */
    private static List<IndexFileEntry> parseSection(String name, String value) {
        List<IndexFileEntry> entries = new ArrayList<>();
        for (String row : value.split("\n")) {
            String trimmed = row.strip();
            if (trimmed.isEmpty())
                continue;

            String[] parts = trimmed.split("\\s+");
            if (parts.length != 3) {
                LOG.debug("Skipping malformed {} row '{}'", name, trimmed);
                continue;
            }
            try {
                entries.add(new IndexFileEntry(parts[2], Long.parseLong(parts[1]), parts[0]));
            } catch (NumberFormatException e) {
                LOG.debug("Skipping {} row with invalid size '{}'", name, parts[1]);
            }
        }
        return entries;
    }
}
