package de.bsommerfeld.debfetch.download;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;

/**
 * Repository transport built on {@link HttpClient}.
 *
 * <p>
 * Supports two modes: in-memory byte download for metadata and index files,
 * and streaming to file (with atomic rename) for package payloads. Each mode
 * comes in a mandatory flavour, which fails on any non-2xx status, and the
 * byte mode also in an optional flavour, which reports a non-2xx status as
 * an empty result so the caller can fall back to the next candidate.
 *
 * <h3>Local repositories</h3>
 * {@code file:} URLs are read straight from the filesystem; a missing file
 * behaves like a 404.
 *
 * <p>
 * Instances are immutable and safe to share between threads. No retries are
 * performed: one failed attempt is final.
 */
public class Downloader {

    private static final Logger LOG = LoggerFactory.getLogger(Downloader.class);

    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMinutes(5);

    private final HttpClient http;
    private final Duration requestTimeout;

    public Downloader() {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(30))
                .build(), DEFAULT_REQUEST_TIMEOUT);
    }

    public Downloader(HttpClient http, Duration requestTimeout) {
        this.http = http;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Downloads a URL entirely into memory.
     *
     * @throws IOException on transport failure or a non-2xx status
     */
    public byte[] toBytes(String url) throws IOException {
        return tryToBytes(url).orElseThrow(() -> new IOException("Resource not found: " + url));
    }

    /**
     * Downloads a URL into memory, or returns empty when the server answers
     * with a non-2xx status.
     *
     * @throws IOException on transport failure only
     */
    public Optional<byte[]> tryToBytes(String url) throws IOException {
        URI uri = URI.create(url);
        if (isFile(uri)) {
            Path path = Path.of(uri);
            if (!Files.isRegularFile(path)) {
                LOG.debug("Local resource {} does not exist", path);
                return Optional.empty();
            }
            return Optional.of(Files.readAllBytes(path));
        }

        HttpResponse<InputStream> response = send(uri);
        try (InputStream in = response.body()) {
            if (!isSuccess(response.statusCode())) {
                LOG.debug("HTTP {} for {}", response.statusCode(), url);
                return Optional.empty();
            }

            long totalBytes = response.headers()
                    .firstValueAsLong("Content-Length")
                    .orElse(-1);
            return Optional.of(readFully(in, totalBytes));
        }
    }

    /**
     * Downloads a URL to the given target file.
     *
     * <p>
     * The download streams into a uniquely named {@code .tmp} sibling first,
     * then atomically renames it to the target path, so an interrupted
     * transfer never leaves a truncated file under the final name and
     * concurrent downloads to the same target never share a temporary file.
     *
     * @throws IOException on transport failure or a non-2xx status
     */
    public void toFile(String url, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, target.getFileName() + ".", ".tmp");

        try {
            URI uri = URI.create(url);
            if (isFile(uri)) {
                Path source = Path.of(uri);
                if (!Files.isRegularFile(source)) {
                    throw new IOException("Resource not found: " + url);
                }
                Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
            } else {
                HttpResponse<InputStream> response = send(uri);
                try (InputStream in = response.body()) {
                    validateStatus(response.statusCode(), url);
                    try (OutputStream out = Files.newOutputStream(temp)) {
                        in.transferTo(out);
                    }
                }
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    // =====================================================================
    // Internals
    // =====================================================================

    private HttpResponse<InputStream> send(URI uri) throws IOException {
        LOG.debug("GET {}", uri);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .GET()
                .build();
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Download interrupted: " + uri, e);
        }
    }

    /**
     * Reads the entire input stream. Pre-allocates to Content-Length when
     * available to avoid repeated internal array copies.
     */
    private static byte[] readFully(InputStream in, long totalBytes) throws IOException {
        int initial = totalBytes > 0 && totalBytes < Integer.MAX_VALUE ? (int) totalBytes : 8192;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(initial);
        in.transferTo(buffer);
        return buffer.toByteArray();
    }

    private static boolean isFile(URI uri) {
        return "file".equalsIgnoreCase(uri.getScheme());
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    /** Validates that the HTTP status code is in the 2xx success range. */
    private static void validateStatus(int status, String url) throws IOException {
        if (!isSuccess(status)) {
            throw new IOException("HTTP " + status + " for " + url);
        }
    }
}
