package de.bsommerfeld.debfetch.index;

import de.bsommerfeld.debfetch.control.ControlParagraph;
import de.bsommerfeld.debfetch.hash.ExpectedChecksum;

import java.util.Optional;

/**
 * The control paragraph of the requested package, together with the index
 * it was found in.
 *
 * @param paragraph the package's fields
 * @param indexPath release-relative path of the index, e.g.
 *                  {@code main/binary-amd64/Packages.gz}
 */
public record PackageControlEntry(ControlParagraph paragraph, String indexPath) {

    public String packageName() {
        return paragraph.get("Package").orElse("");
    }

    public Optional<String> version() {
        return paragraph.get("Version");
    }

    public Optional<String> architecture() {
        return paragraph.get("Architecture");
    }

    /** Pool path of the package file relative to the repository root. */
    public Optional<String> filename() {
        return paragraph.get("Filename").filter(f -> !f.isBlank()).map(String::strip);
    }

    /** Strongest recognized checksum of the package file. */
    public Optional<ExpectedChecksum> checksum() {
        return ExpectedChecksum.strongestOf(paragraph.fields());
    }
}
