package de.bsommerfeld.debfetch.index;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Compressions a Packages index may be published in, in the order they are
 * tried. Concatenated streams are decoded in full, as some mirrors produce
 * multi-member gzip files.
 */
public enum CompressionFormat {

    GZ("gz") {
        @Override
        public InputStream decompress(InputStream compressed) throws IOException {
            return new GzipCompressorInputStream(compressed, true);
        }
    },
    BZ2("bz2") {
        @Override
        public InputStream decompress(InputStream compressed) throws IOException {
            return new BZip2CompressorInputStream(compressed, true);
        }
    },
    XZ("xz") {
        @Override
        public InputStream decompress(InputStream compressed) throws IOException {
            return new XZCompressorInputStream(compressed, true);
        }
    };

    private static final List<CompressionFormat> PREFERENCE = List.of(values());

    private final String extension;

    CompressionFormat(String extension) {
        this.extension = extension;
    }

    public static List<CompressionFormat> preferenceOrder() {
        return PREFERENCE;
    }

    public String extension() {
        return extension;
    }

    /** Appends this format's extension, e.g. {@code Packages} to {@code Packages.gz}. */
    public String apply(String uncompressedPath) {
        return uncompressedPath + "." + extension;
    }

    /** Wraps a compressed stream in a decoding stream. */
    public abstract InputStream decompress(InputStream compressed) throws IOException;
}
