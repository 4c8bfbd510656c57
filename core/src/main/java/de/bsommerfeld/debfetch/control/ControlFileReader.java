package de.bsommerfeld.debfetch.control;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Streaming reader for Debian control files (Release files, Packages
 * indices).
 *
 * <p>
 * Paragraphs are produced one at a time, so a multi-megabyte Packages index
 * is scanned without ever holding more than one paragraph in memory.
 *
 * <h3>Format</h3>
 * <ul>
 * <li>Paragraphs are separated by one or more blank lines</li>
 * <li>{@code Field: value} starts a field; the name ends at the first colon</li>
 * <li>Lines starting with a space or tab continue the previous field; a
 * continuation of just {@code .} stands for an empty line</li>
 * <li>Lines starting with {@code #} are comments</li>
 * </ul>
 * Lines that fit none of these are skipped with a debug log.
 */
public final class ControlFileReader implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ControlFileReader.class);

    private final BufferedReader reader;
    private int lineNumber;

    public ControlFileReader(Reader reader) {
        this.reader = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
    }

    public ControlFileReader(InputStream in) {
        this(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    /** Parses every paragraph of a small in-memory document. */
    public static List<ControlParagraph> parseAll(String document) {
        List<ControlParagraph> paragraphs = new ArrayList<>();
        try (ControlFileReader reader = new ControlFileReader(new StringReader(document))) {
            ControlParagraph paragraph;
            while ((paragraph = reader.next()) != null) {
                paragraphs.add(paragraph);
            }
        } catch (IOException e) {
            // StringReader does not fail
            throw new IllegalStateException(e);
        }
        return paragraphs;
    }

    /**
     * Scans forward and returns the first paragraph accepted by the
     * predicate. Stops reading as soon as a match is found.
     */
    public Optional<ControlParagraph> findFirst(Predicate<ControlParagraph> predicate) throws IOException {
        ControlParagraph paragraph;
        while ((paragraph = next()) != null) {
            if (predicate.test(paragraph)) {
                return Optional.of(paragraph);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the next paragraph, or {@code null} at end of input.
     */
    public ControlParagraph next() throws IOException {
        Map<String, String> fields = new LinkedHashMap<>();
        String currentField = null;
        StringBuilder currentValue = null;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;

            if (line.isBlank()) {
                if (!fields.isEmpty() || currentField != null) {
                    break;
                }
                continue;
            }
            if (line.startsWith("#")) {
                continue;
            }

            char first = line.charAt(0);
            if (first == ' ' || first == '\t') {
                if (currentField == null) {
                    LOG.debug("Continuation line {} without a field, skipping", lineNumber);
                    continue;
                }
                String continued = line.strip();
                currentValue.append('\n').append(continued.equals(".") ? "" : continued);
                continue;
            }

            int colon = line.indexOf(':');
            if (colon <= 0) {
                LOG.debug("Malformed control line {}: '{}', skipping", lineNumber, line);
                continue;
            }

            if (currentField != null) {
                fields.put(currentField, currentValue.toString());
            }
            currentField = line.substring(0, colon).strip();
            currentValue = new StringBuilder(line.substring(colon + 1).strip());
        }

        if (currentField != null) {
            fields.put(currentField, currentValue.toString());
        }
        return fields.isEmpty() ? null : new ControlParagraph(fields);
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
