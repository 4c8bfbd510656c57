package de.bsommerfeld.debfetch.launcher;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.debfetch.download.Downloader;
import de.bsommerfeld.debfetch.trust.GpgSignatureVerifier;
import de.bsommerfeld.debfetch.trust.SignatureVerifier;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Guice module wiring the download pipeline from a loaded configuration.
 */
public class FetcherModule extends AbstractModule {

    private final FetcherConfig config;

    public FetcherModule(FetcherConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(FetcherConfig.class).toInstance(config);
    }

    @Provides
    @Singleton
    Downloader downloader(FetcherConfig config) {
        HttpClient http = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(config.getConnectTimeoutSeconds()))
                .build();
        return new Downloader(http, Duration.ofSeconds(config.getRequestTimeoutSeconds()));
    }

    @Provides
    @Singleton
    SignatureVerifier signatureVerifier(FetcherConfig config) {
        return new GpgSignatureVerifier(config.getGpgExecutable(), Duration.ofSeconds(config.getGpgTimeoutSeconds()));
    }
}
