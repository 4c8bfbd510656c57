package de.bsommerfeld.debfetch.control;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One paragraph of a Debian control file: an ordered field-name-to-value
 * mapping. Multi-line values keep their continuation lines separated by
 * {@code \n}; the first line of a value whose content starts on the next
 * line is empty.
 *
 * @param fields field values in document order
 */
public record ControlParagraph(Map<String, String> fields) {

    public ControlParagraph {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Optional<String> get(String field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }
}
