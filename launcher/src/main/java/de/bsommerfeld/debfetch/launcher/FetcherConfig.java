package de.bsommerfeld.debfetch.launcher;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings read from {@code debfetch.toml}. Every key is optional; a missing
 * file or key keeps the default shown in the field initializer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FetcherConfig {

    @JsonProperty("gpg-executable")
    private String gpgExecutable = "gpg";

    @JsonProperty("gpg-timeout-seconds")
    private int gpgTimeoutSeconds = 120;

    @JsonProperty("connect-timeout-seconds")
    private int connectTimeoutSeconds = 30;

    @JsonProperty("request-timeout-seconds")
    private int requestTimeoutSeconds = 300;

    @JsonProperty("architectures")
    private List<String> architectures = new ArrayList<>(List.of("amd64"));

    @JsonProperty("destination")
    private String destination = System.getProperty("java.io.tmpdir");

    public String getGpgExecutable() {
        return gpgExecutable;
    }

    public void setGpgExecutable(String gpgExecutable) {
        this.gpgExecutable = gpgExecutable;
    }

    public int getGpgTimeoutSeconds() {
        return gpgTimeoutSeconds;
    }

    public void setGpgTimeoutSeconds(int gpgTimeoutSeconds) {
        this.gpgTimeoutSeconds = gpgTimeoutSeconds;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
        this.connectTimeoutSeconds = connectTimeoutSeconds;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public List<String> getArchitectures() {
        return architectures;
    }

    public void setArchitectures(List<String> architectures) {
        this.architectures = architectures;
    }

    public String getDestination() {
        return destination;
    }

    public void setDestination(String destination) {
        this.destination = destination;
    }
}
