package io.openpayments.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.openpayments.config.OpenPaymentsClientConfig;
import io.openpayments.exception.HttpStatusException;
import io.openpayments.exception.ProtocolException;
import io.openpayments.exception.TokenExpiredException;
import io.openpayments.model.AccessToken;
import io.openpayments.model.Amount;
import io.openpayments.model.CreateIncomingPaymentRequest;
import io.openpayments.model.CreateOutgoingPaymentRequest;
import io.openpayments.model.IncomingPayment;
import io.openpayments.model.OutgoingPayment;
import io.openpayments.util.Json;
import io.openpayments.util.LogSanitizer;
import io.openpayments.util.Urls;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link ResourceClient} bound to one resource server and one access token.
 * Requests carry {@code Authorization: GNAP <token>} and are not signed.
 */
@Slf4j
public class HttpResourceClient implements ResourceClient {

    private final String baseUrl;
    private final String accessToken;
    private final HttpExchange exchange;

    public HttpResourceClient(String resourceServerUrl, String accessToken) {
        this(resourceServerUrl, accessToken, HttpExchange.withDefaults());
    }

    public HttpResourceClient(String resourceServerUrl, AccessToken accessToken) {
        this(resourceServerUrl, Objects.requireNonNull(accessToken, "accessToken").value);
    }

    public HttpResourceClient(String resourceServerUrl, String accessToken, HttpClient http) {
        this(resourceServerUrl, accessToken, new HttpExchange(http, Duration.ofSeconds(30)));
    }

    public HttpResourceClient(OpenPaymentsClientConfig config, AccessToken accessToken) {
        this(Objects.requireNonNull(config.getResourceServerUrl(), "resourceServerUrl").toString(),
            Objects.requireNonNull(accessToken, "accessToken").value,
            new HttpExchange(config.getConnectTimeout(), config.getRequestTimeout()));
    }

    HttpResourceClient(String resourceServerUrl, String accessToken, HttpExchange exchange) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken is required");
        }
        this.baseUrl = Urls.trimTrailingSlash(resourceServerUrl);
        this.accessToken = accessToken;
        this.exchange = exchange;
    }

    @Override
    public IncomingPayment createIncomingPayment(String walletAddress, Amount incomingAmount,
                                                 String expiresAt, Map<String, Object> metadata)
            throws IOException, InterruptedException {
        CreateIncomingPaymentRequest body =
            new CreateIncomingPaymentRequest(walletAddress, incomingAmount, expiresAt, metadata);
        log.info("Creating incoming payment for {}", LogSanitizer.sanitize(walletAddress));

        IncomingPayment payment = post("/incoming-payments", body, IncomingPayment.class);
        if (payment.walletAddress == null) payment.walletAddress = walletAddress;
        if (payment.incomingAmount == null) payment.incomingAmount = incomingAmount;
        if (payment.expiresAt == null) payment.expiresAt = expiresAt;
        if (payment.metadata == null) payment.metadata = body.metadata();

        log.info("Incoming payment created: {}", LogSanitizer.sanitize(payment.id));
        return payment;
    }

    @Override
    public OutgoingPayment createOutgoingPayment(String walletAddress, String quoteId, Map<String, Object> metadata)
            throws IOException, InterruptedException {
        CreateOutgoingPaymentRequest body = new CreateOutgoingPaymentRequest(walletAddress, quoteId, metadata);
        log.info("Creating outgoing payment for {} with quote {}",
            LogSanitizer.sanitize(walletAddress), LogSanitizer.sanitize(quoteId));

        OutgoingPayment payment = post("/outgoing-payments", body, OutgoingPayment.class);
        if (payment.walletAddress == null) payment.walletAddress = walletAddress;
        if (payment.quoteId == null) payment.quoteId = quoteId;
        if (payment.metadata == null) payment.metadata = body.metadata();

        log.info("Outgoing payment created: {} (failed={})", LogSanitizer.sanitize(payment.id), payment.failed);
        return payment;
    }

    @Override
    public IncomingPayment getIncomingPayment(String resourceUrl) throws IOException, InterruptedException {
        IncomingPayment payment = get(resourceUrl, IncomingPayment.class);
        log.info("Incoming payment {}: completed={}", LogSanitizer.sanitize(resourceUrl), payment.completed);
        return payment;
    }

    @Override
    public OutgoingPayment getOutgoingPayment(String resourceUrl) throws IOException, InterruptedException {
        OutgoingPayment payment = get(resourceUrl, OutgoingPayment.class);
        log.info("Outgoing payment {}: failed={}", LogSanitizer.sanitize(resourceUrl), payment.failed);
        return payment;
    }

    @Override
    public void close() {
        exchange.close();
    }

    private <T> T post(String path, Object body, Class<T> type) throws IOException, InterruptedException {
        String json;
        try {
            json = Json.MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Cannot serialize request body", 0, null, e);
        }
        HttpRequest request = authorized(URI.create(baseUrl + path))
            .header(HttpExchange.CONTENT_TYPE, HttpExchange.APPLICATION_JSON)
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();
        return read(exchange.send(request), type);
    }

    private <T> T get(String resourceUrl, Class<T> type) throws IOException, InterruptedException {
        // resource ids are full URLs and are used exactly as the server returned them
        HttpRequest request = authorized(Urls.requireAbsoluteHttpUrl(resourceUrl)).GET().build();
        return read(exchange.send(request), type);
    }

    private HttpRequest.Builder authorized(URI uri) {
        return exchange.request(uri)
            .header(HttpExchange.AUTHORIZATION, HttpExchange.gnap(accessToken))
            .header(HttpExchange.ACCEPT, HttpExchange.APPLICATION_JSON);
    }

    private static <T> T read(HttpResponse<String> response, Class<T> type) throws IOException {
        int status = response.statusCode();
        if (status == 401) {
            log.warn("Resource server rejected the access token; a new grant is needed");
            throw new TokenExpiredException(response.body());
        }
        if (!HttpExchange.isSuccess(status)) {
            throw new HttpStatusException(status, response.body());
        }
        T value;
        try {
            value = Json.MAPPER.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw ProtocolException.unreadable("Resource response", status, response.body(), e);
        }
        if (value == null) {
            throw new ProtocolException("Resource response is empty", "id", status, response.body());
        }
        return value;
    }
}
