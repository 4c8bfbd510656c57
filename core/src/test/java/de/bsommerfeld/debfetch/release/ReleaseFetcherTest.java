package de.bsommerfeld.debfetch.release;

import com.github.tomakehurst.wiremock.WireMockServer;
import de.bsommerfeld.debfetch.RepositoryFixture;
import de.bsommerfeld.debfetch.download.Downloader;
import de.bsommerfeld.debfetch.error.RepositoryUnreachableException;
import de.bsommerfeld.debfetch.repo.RepositoryDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;

class ReleaseFetcherTest {

    private WireMockServer server;
    private RepositoryFixture repo;
    private RepositoryDescriptor descriptor;
    private ReleaseFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        server = new WireMockServer(wireMockConfig().dynamicPort());
        server.start();
        repo = new RepositoryFixture(server, "/debian");
        descriptor = RepositoryDescriptor.parse(repo.spec("main"));
        fetcher = new ReleaseFetcher(new Downloader());
    }

    @AfterEach
    void tearDown() {
        if (server.isRunning()) {
            server.stop();
        }
    }

    @Test
    void fetch_shouldPreferInRelease() throws Exception {
        repo.serveDist("InRelease", "signed");
        repo.serveDist("Release", "plain");

        FetchedRelease release = fetcher.fetch(descriptor, true);

        assertTrue(release.inlineSigned());
        assertEquals("signed", release.contentAsString());
        assertEquals("InRelease", release.fileName());
        assertTrue(release.detachedSignature().isEmpty());
        assertTrue(release.sourceUrl().endsWith("/debian/dists/bullseye/InRelease"));
        server.verify(0, getRequestedFor(urlEqualTo("/debian/dists/bullseye/Release")));
        server.verify(0, getRequestedFor(urlEqualTo("/debian/dists/bullseye/Release.gpg")));
    }

    @Test
    void fetch_shouldFallBackToReleaseWithoutSignatureWhenNoKey() throws Exception {
        repo.serveDist("Release", "plain");

        FetchedRelease release = fetcher.fetch(descriptor, false);

        assertFalse(release.inlineSigned());
        assertEquals("Release", release.fileName());
        assertEquals("plain", release.contentAsString());
        assertTrue(release.detachedSignature().isEmpty());
        server.verify(0, getRequestedFor(urlEqualTo("/debian/dists/bullseye/Release.gpg")));
    }

    @Test
    void fetch_shouldFetchDetachedSignatureWhenKeyConfigured() throws Exception {
        repo.failDist("InRelease", 500);
        repo.serveDist("Release", "plain");
        repo.serveDist("Release.gpg", "sig");

        FetchedRelease release = fetcher.fetch(descriptor, true);

        assertFalse(release.inlineSigned());
        assertEquals("sig", new String(release.detachedSignature().orElseThrow()));
    }

    @Test
    void fetch_shouldFailWhenDetachedSignatureMissing() {
        repo.serveDist("Release", "plain");

        var ex = assertThrows(RepositoryUnreachableException.class, () -> fetcher.fetch(descriptor, true));
        assertTrue(ex.getMessage().contains("Release.gpg"));
    }

    @Test
    void fetch_shouldFailWhenNoReleaseAvailable() {
        var ex = assertThrows(RepositoryUnreachableException.class, () -> fetcher.fetch(descriptor, false));

        assertEquals("Unable to fetch archive element '" + repo.baseUri() + "/dists/bullseye/Release'",
                ex.getMessage());
    }

    @Test
    void fetch_shouldFailWhenServerUnreachable() {
        server.stop();
        assertThrows(RepositoryUnreachableException.class, () -> fetcher.fetch(descriptor, false));
    }
}
