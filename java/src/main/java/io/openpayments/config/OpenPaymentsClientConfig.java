package io.openpayments.config;

import java.net.URI;
import java.time.Duration;

import io.openpayments.util.Urls;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class OpenPaymentsClientConfig {

    private URI authServerUrl;
    private URI resourceServerUrl;
    private String walletAddress;
    private String clientId;
    private String keyId;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(30);

    /** Scheme, host and port of the wallet address; where quotes are created. */
    public String walletBaseUrl() {
        if (walletAddress == null || walletAddress.isBlank()) {
            throw new IllegalStateException("walletAddress is not configured");
        }
        return Urls.originOf(walletAddress);
    }
}
