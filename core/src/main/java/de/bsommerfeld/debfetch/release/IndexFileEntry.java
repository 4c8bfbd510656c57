package de.bsommerfeld.debfetch.release;

/**
 * One row of a Release checksum section.
 *
 * @param relativePath path below {@code dists/<distribution>}, e.g.
 *                     {@code main/binary-amd64/Packages.gz}
 * @param size         declared size in bytes
 * @param checksum     hex digest in the section's algorithm
 */
public record IndexFileEntry(String relativePath, long size, String checksum) {}
