package de.bsommerfeld.debfetch;

import com.github.tomakehurst.wiremock.WireMockServer;
import de.bsommerfeld.debfetch.hash.ChecksumAlgorithm;
import de.bsommerfeld.debfetch.hash.HashUtil;
import de.bsommerfeld.debfetch.index.CompressionFormat;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;

/**
 * Serves a fake Debian repository from a {@link WireMockServer}. Anything not
 * explicitly served answers with 404.
 */
public final class RepositoryFixture {

    public static final String DISTRIBUTION = "bullseye";

    private final WireMockServer server;
    private final String basePath;

    public RepositoryFixture(WireMockServer server, String basePath) {
        this.server = server;
        this.basePath = basePath;
    }

    public String baseUri() {
        return server.baseUrl() + basePath;
    }

    public String spec(String... components) {
        return "deb " + baseUri() + " " + DISTRIBUTION + " " + String.join(" ", components);
    }

    /** Serves a file relative to the repository root. */
    public void serve(String relativePath, byte[] body) {
        server.stubFor(get(urlEqualTo(basePath + "/" + relativePath))
                .willReturn(aResponse().withStatus(200).withBody(body)));
    }

    /** Serves a file relative to {@code dists/<distribution>}. */
    public void serveDist(String relativePath, byte[] body) {
        serve("dists/" + DISTRIBUTION + "/" + relativePath, body);
    }

    public void serveDist(String relativePath, String body) {
        serveDist(relativePath, body.getBytes(StandardCharsets.UTF_8));
    }

    /** Answers a dists file with the given status and no body. */
    public void failDist(String relativePath, int status) {
        server.stubFor(get(urlEqualTo(basePath + "/dists/" + DISTRIBUTION + "/" + relativePath))
                .willReturn(aResponse().withStatus(status)));
    }

    // =====================================================================
    // Content builders
    // =====================================================================

    public static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] compress(CompressionFormat format, String text) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (OutputStream out = switch (format) {
            case GZ -> new GzipCompressorOutputStream(buffer);
            case BZ2 -> new BZip2CompressorOutputStream(buffer);
            case XZ -> new XZCompressorOutputStream(buffer);
        }) {
            out.write(bytes(text));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return buffer.toByteArray();
    }

    /** A Packages paragraph carrying every checksum field for the payload. */
    public static String packageParagraph(String name, String version, String filename, byte[] payload) {
        return "Package: " + name + "\n"
                + "Version: " + version + "\n"
                + "Architecture: amd64\n"
                + "Maintainer: Debian Maintainers <debian@example.test>\n"
                + "Installed-Size: 500\n"
                + "Depends: libc6 (>= 2.17)\n"
                + "Description: " + name + " test package\n"
                + " Multi-line description of " + name + ".\n"
                + " .\n"
                + " Second paragraph.\n"
                + "Filename: " + filename + "\n"
                + "Size: " + payload.length + "\n"
                + "MD5sum: 00000000000000000000000000000000\n"
                + "SHA256: " + HashUtil.digest(ChecksumAlgorithm.SHA256, payload) + "\n"
                + "SHA512: " + HashUtil.digest(ChecksumAlgorithm.SHA512, payload) + "\n";
    }

    /** Joins paragraphs into an index document. */
    public static String packagesIndex(String... paragraphs) {
        return String.join("\n", paragraphs);
    }

    /** Wraps a document in a syntactically valid but unverifiable clear signature. */
    public static String clearsign(String document) {
        StringBuilder sb = new StringBuilder("-----BEGIN PGP SIGNED MESSAGE-----\nHash: SHA512\n\n");
        document.lines().forEach(line -> sb.append(line.startsWith("-") ? "- " + line : line).append('\n'));
        sb.append("-----BEGIN PGP SIGNATURE-----\n\n")
                .append("iQIzBAEBCgAdFiEEfakefakefakefakefakefakefakefakeFAKE=\n")
                .append("=AbCd\n")
                .append("-----END PGP SIGNATURE-----\n");
        return sb.toString();
    }

    public static ReleaseBuilder release() {
        return new ReleaseBuilder();
    }

    /**
     * Builds a Release document. Files added with {@link #add} are listed in
     * every enabled checksum section with their real digests.
     */
    public static final class ReleaseBuilder {

        private final Set<ChecksumAlgorithm> enabled = EnumSet.allOf(ChecksumAlgorithm.class);
        private final Map<ChecksumAlgorithm, List<String>> rows = new EnumMap<>(ChecksumAlgorithm.class);

        private ReleaseBuilder() {
        }

        /** Restricts the release to the given sections. */
        public ReleaseBuilder sections(ChecksumAlgorithm... algorithms) {
            enabled.clear();
            enabled.addAll(List.of(algorithms));
            return this;
        }

        public ReleaseBuilder add(String path, byte[] content) {
            for (ChecksumAlgorithm algorithm : enabled) {
                addRaw(algorithm, path, HashUtil.digest(algorithm, content), content.length);
            }
            return this;
        }

        public ReleaseBuilder addRaw(ChecksumAlgorithm algorithm, String path, String digest, long size) {
            rows.computeIfAbsent(algorithm, a -> new ArrayList<>())
                    .add(" " + digest + " " + size + " " + path);
            return this;
        }

        public String build() {
            StringBuilder sb = new StringBuilder()
                    .append("Origin: Debian\n")
                    .append("Label: Debian\n")
                    .append("Suite: stable\n")
                    .append("Codename: ").append(DISTRIBUTION).append('\n')
                    .append("Date: Sat, 07 Oct 2023 09:45:12 UTC\n")
                    .append("Architectures: amd64 arm64\n")
                    .append("Components: main contrib non-free\n")
                    .append("Description: Debian 11.8 Released 07 October 2023\n")
                    .append("MD5Sum:\n")
                    .append(" 0123456789abcdef0123456789abcdef 1234 main/binary-amd64/Packages.gz\n");
            for (ChecksumAlgorithm algorithm : List.of(ChecksumAlgorithm.SHA256, ChecksumAlgorithm.SHA512)) {
                List<String> section = rows.get(algorithm);
                if (section == null)
                    continue;
                sb.append(algorithm.sectionName()).append(":\n");
                section.forEach(row -> sb.append(row).append('\n'));
            }
            return sb.toString();
        }
    }
}
