package io.openpayments.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.openpayments.config.OpenPaymentsClientConfig;
import io.openpayments.crypto.Ed25519RequestSigner;
import io.openpayments.crypto.RequestSigner;
import io.openpayments.crypto.SignatureHeaders;
import io.openpayments.crypto.SigningContext;
import io.openpayments.exception.HttpStatusException;
import io.openpayments.exception.InvalidContinuationException;
import io.openpayments.exception.ProtocolException;
import io.openpayments.exception.UnexpectedInteractionException;
import io.openpayments.model.AccessRight;
import io.openpayments.model.AccessToken;
import io.openpayments.model.Continuation;
import io.openpayments.model.GrantRequest;
import io.openpayments.model.GrantResponse;
import io.openpayments.model.GrantState;
import io.openpayments.model.InteractionHandle;
import io.openpayments.util.Json;
import io.openpayments.util.LogSanitizer;
import io.openpayments.util.Urls;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link GrantClient} talking to an authorization server over HTTP.
 *
 * <p>Grant requests are signed with the configured {@link RequestSigner}; continuation and
 * token management requests carry {@code Authorization: GNAP <token>} only. Continuations
 * received in pending responses are remembered until they are used, so one instance can
 * drive several independent negotiations.
 */
@Slf4j
public class HttpGrantClient implements GrantClient {

    private static final int NONCE_BYTES = 32;

    private final String grantEndpoint;
    private final RequestSigner signer;
    private final HttpExchange exchange;
    private final SecureRandom random = new SecureRandom();
    /** continuation URI -> continuation token */
    private final Map<String, String> pendingContinuations = new ConcurrentHashMap<>();

    public HttpGrantClient(String authServerUrl, RequestSigner signer) {
        this(authServerUrl, signer, HttpExchange.withDefaults());
    }

    public HttpGrantClient(String authServerUrl, RequestSigner signer, HttpClient http) {
        this(authServerUrl, signer, new HttpExchange(http, Duration.ofSeconds(30)));
    }

    public HttpGrantClient(OpenPaymentsClientConfig config, SigningContext signingContext) {
        this(Objects.requireNonNull(config.getAuthServerUrl(), "authServerUrl").toString(),
            new Ed25519RequestSigner(signingContext),
            new HttpExchange(config.getConnectTimeout(), config.getRequestTimeout()));
    }

    public HttpGrantClient(OpenPaymentsClientConfig config, PrivateKey privateKey) {
        this(config, new SigningContext(config.getKeyId(), privateKey));
    }

    HttpGrantClient(String authServerUrl, RequestSigner signer, HttpExchange exchange) {
        this.grantEndpoint = Urls.trimTrailingSlash(authServerUrl) + "/";
        this.signer = Objects.requireNonNull(signer, "signer");
        this.exchange = exchange;
    }

    @Override
    public GrantResponse requestGrantNonInteractive(List<AccessRight> accessRights, String clientId)
            throws IOException, InterruptedException {
        GrantRequest request = GrantRequest.nonInteractive(accessRights, clientId);
        log.info("Requesting non-interactive grant for {}", describe(accessRights));

        GrantResponse response = send(request);
        if (!response.isGranted()) {
            log.warn("Non-interactive grant for {} requires interaction", describe(accessRights));
            throw new UnexpectedInteractionException(response.interact.redirectUrl);
        }
        logGranted(response.accessToken);
        return response;
    }

    @Override
    public GrantResponse requestGrantInteractive(List<AccessRight> accessRights, String clientId, String redirectUri)
            throws IOException, InterruptedException {
        GrantRequest request = GrantRequest.interactive(accessRights, clientId, redirectUri, generateNonce());
        log.info("Requesting interactive grant for {}", describe(accessRights));

        GrantResponse response = send(request);
        if (response.isGranted()) {
            logGranted(response.accessToken);
            return response;
        }

        Continuation continuation = response.continuation;
        if (continuation != null && continuation.uri != null && continuation.tokenValue() != null) {
            pendingContinuations.put(continuation.uri, continuation.tokenValue());
        } else {
            log.warn("Pending grant response carries no usable continuation");
        }
        log.info("Grant {}: user must consent at {}",
            GrantState.PENDING_INTERACTION, LogSanitizer.sanitize(response.interact.redirectUrl));
        return response;
    }

    @Override
    public GrantResponse continueGrant(String continuationUri, String continuationToken, String interactRef)
            throws IOException, InterruptedException {
        if (continuationUri == null || continuationUri.isBlank()
            || continuationToken == null || continuationToken.isBlank()) {
            throw new InvalidContinuationException(continuationUri, "continuation URI and token are required");
        }
        String pendingToken = pendingContinuations.get(continuationUri);
        if (pendingToken == null) {
            throw new InvalidContinuationException(continuationUri, "no interaction is pending for it");
        }
        if (!pendingToken.equals(continuationToken)) {
            throw new InvalidContinuationException(continuationUri, "token does not match the pending interaction");
        }

        log.info("Grant {} at {}", GrantState.CONTINUING, LogSanitizer.sanitize(continuationUri));
        HttpRequest.Builder builder = exchange.request(Urls.requireAbsoluteHttpUrl(continuationUri))
            .header(HttpExchange.AUTHORIZATION, HttpExchange.gnap(continuationToken))
            .header(HttpExchange.ACCEPT, HttpExchange.APPLICATION_JSON);
        if (interactRef != null) {
            builder.header(HttpExchange.CONTENT_TYPE, HttpExchange.APPLICATION_JSON)
                .POST(HttpRequest.BodyPublishers.ofString(toJson(Map.of("interact_ref", interactRef))));
        } else {
            builder.POST(HttpRequest.BodyPublishers.noBody());
        }

        // kept pending until the server answers, so a failed send can be retried
        HttpResponse<String> resp = exchange.send(builder.build());
        pendingContinuations.remove(continuationUri, continuationToken);

        GrantResponse response = readGrantResponse(resp);
        if (!response.isGranted()) {
            throw new ProtocolException(
                "Continuation response carries no access_token", "access_token", resp.statusCode(), resp.body());
        }
        logGranted(response.accessToken);
        return response;
    }

    @Override
    public GrantResponse continueGrant(InteractionHandle handle, String interactRef)
            throws IOException, InterruptedException {
        if (handle == null || handle.continuation == null) {
            throw new InvalidContinuationException(null, "interaction handle carries no continuation");
        }
        return continueGrant(handle.continuation.uri, handle.continuation.tokenValue(), interactRef);
    }

    @Override
    public AccessToken rotateToken(AccessToken token) throws IOException, InterruptedException {
        HttpRequest request = manageRequest(token)
            .header(HttpExchange.ACCEPT, HttpExchange.APPLICATION_JSON)
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();
        HttpResponse<String> resp = exchange.send(request);
        GrantResponse response = readGrantResponse(resp);
        if (!response.isGranted()) {
            throw new ProtocolException(
                "Token rotation response carries no access_token", "access_token", resp.statusCode(), resp.body());
        }
        log.info("Rotated access token {} -> {}",
            LogSanitizer.maskIdentifier(token.value), LogSanitizer.maskIdentifier(response.accessToken.value));
        return response.accessToken;
    }

    @Override
    public void revokeToken(AccessToken token) throws IOException, InterruptedException {
        HttpRequest request = manageRequest(token).DELETE().build();
        HttpResponse<String> resp = exchange.send(request);
        if (!HttpExchange.isSuccess(resp.statusCode())) {
            throw new HttpStatusException(resp.statusCode(), resp.body());
        }
        log.info("Revoked access token {}", LogSanitizer.maskIdentifier(token.value));
    }

    @Override
    public void close() {
        exchange.close();
    }

    /** Number of continuations received and not yet used. */
    int pendingContinuationCount() {
        return pendingContinuations.size();
    }

    private GrantResponse send(GrantRequest request) throws IOException, InterruptedException {
        String body = toJson(request);
        log.debug("Grant {}: interactive={}", GrantState.BUILDING, request.isInteractive());
        // signed per attempt; the timestamp makes every header set unique
        SignatureHeaders signature = signer.sign("POST", grantEndpoint, body);
        HttpRequest httpRequest = signature.applyTo(exchange.request(URI.create(grantEndpoint)))
            .header(HttpExchange.CONTENT_TYPE, HttpExchange.APPLICATION_JSON)
            .header(HttpExchange.ACCEPT, HttpExchange.APPLICATION_JSON)
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        log.debug("Grant {}: POST {}", GrantState.SENT, grantEndpoint);
        GrantResponse response = readGrantResponse(exchange.send(httpRequest));
        log.debug("Grant request for client {} -> {}", LogSanitizer.sanitize(request.clientId()), response.getState());
        return response;
    }

    private HttpRequest.Builder manageRequest(AccessToken token) {
        Objects.requireNonNull(token, "token");
        if (token.value == null || token.value.isBlank()) {
            throw new IllegalArgumentException("Access token has no value");
        }
        return exchange.request(Urls.requireAbsoluteHttpUrl(token.manageUrl))
            .header(HttpExchange.AUTHORIZATION, HttpExchange.gnap(token.value));
    }

    private static GrantResponse readGrantResponse(HttpResponse<String> resp) throws IOException {
        int status = resp.statusCode();
        if (!HttpExchange.isSuccess(status)) {
            log.warn("Grant {}: HTTP {}", GrantState.FAILED, status);
            throw new HttpStatusException(status, resp.body());
        }

        GrantResponse response;
        try {
            response = Json.MAPPER.readValue(resp.body(), GrantResponse.class);
        } catch (JsonProcessingException e) {
            throw ProtocolException.unreadable("Grant response", status, resp.body(), e);
        }
        if (response == null || response.getState() == GrantState.FAILED) {
            throw ProtocolException.missingGrantOutcome(status, resp.body());
        }
        if (response.accessToken != null
            && (response.accessToken.value == null || response.accessToken.value.isEmpty())) {
            throw new ProtocolException("Access token has no value", "access_token.value", status, resp.body());
        }
        if (response.accessToken == null
            && (response.interact.redirectUrl == null || response.interact.redirectUrl.isBlank())) {
            throw new ProtocolException("Interaction has no redirect URL", "interact.redirect", status, resp.body());
        }
        if (response.interact != null) {
            response.interact.continuation = response.continuation;
        }
        return response;
    }

    private String generateNonce() {
        byte[] bytes = new byte[NONCE_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static String toJson(Object value) throws ProtocolException {
        try {
            return Json.MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Cannot serialize request body", 0, null, e);
        }
    }

    private static String describe(List<AccessRight> accessRights) {
        if (accessRights == null) {
            return "[]";
        }
        return accessRights.stream()
            .map(right -> right.resourceType().wireName())
            .collect(Collectors.joining(", ", "[", "]"));
    }

    private static void logGranted(AccessToken token) {
        log.info("Grant {}: token {} expires in {}s", GrantState.GRANTED,
            LogSanitizer.maskIdentifier(token.value), token.expiresInSeconds == null ? "?" : token.expiresInSeconds);
    }
}
