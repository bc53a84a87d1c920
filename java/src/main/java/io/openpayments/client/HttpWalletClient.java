package io.openpayments.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.openpayments.config.OpenPaymentsClientConfig;
import io.openpayments.exception.HttpStatusException;
import io.openpayments.exception.ProtocolException;
import io.openpayments.model.WalletAddress;
import io.openpayments.util.Json;
import io.openpayments.util.LogSanitizer;
import io.openpayments.util.Urls;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

/** {@link WalletClient} over plain, unauthenticated HTTP. */
@Slf4j
public class HttpWalletClient implements WalletClient {

    private final HttpExchange exchange;

    public HttpWalletClient() {
        this(HttpExchange.withDefaults());
    }

    public HttpWalletClient(HttpClient http) {
        this(new HttpExchange(http, Duration.ofSeconds(30)));
    }

    public HttpWalletClient(OpenPaymentsClientConfig config) {
        this(new HttpExchange(config.getConnectTimeout(), config.getRequestTimeout()));
    }

    HttpWalletClient(HttpExchange exchange) {
        this.exchange = exchange;
    }

    @Override
    public WalletAddress getWalletAddress(String walletAddressUrl) throws IOException, InterruptedException {
        HttpRequest request = exchange.request(Urls.requireAbsoluteHttpUrl(walletAddressUrl))
            .header(HttpExchange.ACCEPT, HttpExchange.APPLICATION_JSON)
            .GET()
            .build();
        HttpResponse<String> response = exchange.send(request);
        if (!HttpExchange.isSuccess(response.statusCode())) {
            throw new HttpStatusException(response.statusCode(), response.body());
        }

        WalletAddress wallet;
        try {
            wallet = Json.MAPPER.readValue(response.body(), WalletAddress.class);
        } catch (JsonProcessingException e) {
            throw ProtocolException.unreadable("Wallet address response", response.statusCode(), response.body(), e);
        }
        if (wallet == null) {
            throw new ProtocolException("Wallet address response is empty", "id", response.statusCode(), response.body());
        }
        log.info("Wallet {} found (auth server {})",
            LogSanitizer.sanitize(wallet.id), LogSanitizer.sanitize(wallet.authServer));
        return wallet;
    }

    @Override
    public void close() {
        exchange.close();
    }
}
