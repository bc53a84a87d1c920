package io.openpayments.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.openpayments.config.OpenPaymentsClientConfig;
import io.openpayments.crypto.Ed25519RequestSigner;
import io.openpayments.crypto.RequestSigner;
import io.openpayments.crypto.SigningContext;
import io.openpayments.exception.HttpStatusException;
import io.openpayments.exception.ProtocolException;
import io.openpayments.model.CreateQuoteRequest;
import io.openpayments.model.Quote;
import io.openpayments.util.Json;
import io.openpayments.util.LogSanitizer;
import io.openpayments.util.Urls;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link QuoteClient} for the quotes endpoint on the wallet's own host.
 * Every request is signed with the configured {@link RequestSigner}.
 */
@Slf4j
public class HttpQuoteClient implements QuoteClient {

    private final String quotesEndpoint;
    private final RequestSigner signer;
    private final HttpExchange exchange;

    public HttpQuoteClient(String baseUrl, RequestSigner signer) {
        this(baseUrl, signer, HttpExchange.withDefaults());
    }

    public HttpQuoteClient(String baseUrl, RequestSigner signer, HttpClient http) {
        this(baseUrl, signer, new HttpExchange(http, Duration.ofSeconds(30)));
    }

    public HttpQuoteClient(OpenPaymentsClientConfig config, SigningContext signingContext) {
        this(config.walletBaseUrl(), new Ed25519RequestSigner(signingContext),
            new HttpExchange(config.getConnectTimeout(), config.getRequestTimeout()));
    }

    HttpQuoteClient(String baseUrl, RequestSigner signer, HttpExchange exchange) {
        this.quotesEndpoint = Urls.trimTrailingSlash(baseUrl) + "/quotes";
        this.signer = Objects.requireNonNull(signer, "signer");
        this.exchange = exchange;
    }

    /** Client for the host serving {@code walletAddress}. */
    public static HttpQuoteClient forWallet(String walletAddress, RequestSigner signer) {
        return new HttpQuoteClient(Urls.originOf(walletAddress), signer);
    }

    @Override
    public Quote createQuote(CreateQuoteRequest request) throws IOException, InterruptedException {
        Objects.requireNonNull(request, "request");
        String body;
        try {
            body = Json.MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Cannot serialize request body", 0, null, e);
        }
        log.info("Creating quote for {}", LogSanitizer.sanitize(request.walletAddress()));

        HttpRequest httpRequest = signer.sign("POST", quotesEndpoint, body)
            .applyTo(exchange.request(URI.create(quotesEndpoint)))
            .header(HttpExchange.CONTENT_TYPE, HttpExchange.APPLICATION_JSON)
            .header(HttpExchange.ACCEPT, HttpExchange.APPLICATION_JSON)
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        Quote quote = read(exchange.send(httpRequest));
        log.info("Quote created: {}", LogSanitizer.sanitize(quote.id));
        return quote;
    }

    @Override
    public Quote getQuote(String quoteUrl) throws IOException, InterruptedException {
        URI uri = Urls.requireAbsoluteHttpUrl(quoteUrl);
        HttpRequest httpRequest = signer.sign("GET", quoteUrl, null)
            .applyTo(exchange.request(uri))
            .header(HttpExchange.ACCEPT, HttpExchange.APPLICATION_JSON)
            .GET()
            .build();
        return read(exchange.send(httpRequest));
    }

    @Override
    public void close() {
        exchange.close();
    }

    private static Quote read(HttpResponse<String> response) throws IOException {
        int status = response.statusCode();
        if (!HttpExchange.isSuccess(status)) {
            throw new HttpStatusException(status, response.body());
        }
        try {
            Quote quote = Json.MAPPER.readValue(response.body(), Quote.class);
            if (quote == null) {
                throw new ProtocolException("Quote response is empty", "id", status, response.body());
            }
            return quote;
        } catch (JsonProcessingException e) {
            throw ProtocolException.unreadable("Quote response", status, response.body(), e);
        }
    }
}
