package io.openpayments.crypto;

import io.openpayments.exception.SigningException;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.Signature;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;

/**
 * Signs requests with Ed25519 over a canonical string:
 * <pre>
 * METHOD \n URL \n TIMESTAMP [\n base64(sha256(body))]
 * </pre>
 * The digest line is present only when the request has a non-empty body.
 */
public final class Ed25519RequestSigner implements RequestSigner {

    public static final String ALGORITHM = "ed25519";

    private final SigningContext context;
    private final Clock clock;

    public Ed25519RequestSigner(SigningContext context) {
        this(context, Clock.systemUTC());
    }

    public Ed25519RequestSigner(SigningContext context, Clock clock) {
        this.context = Objects.requireNonNull(context, "context");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public SignatureHeaders sign(String method, String url, String body) throws SigningException {
        return sign(method, url, body, clock.instant());
    }

    /** Signs at an explicit creation time; deterministic for a given key. */
    public SignatureHeaders sign(String method, String url, String body, Instant createdAt) throws SigningException {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(createdAt, "createdAt");

        String timestamp = DateTimeFormatter.ISO_INSTANT.format(createdAt);
        String content = canonicalString(method, url, timestamp, body);

        byte[] signatureBytes;
        try {
            Signature signature = Signature.getInstance("Ed25519");
            signature.initSign(context.privateKey());
            signature.update(content.getBytes(StandardCharsets.UTF_8));
            signatureBytes = signature.sign();
        } catch (GeneralSecurityException e) {
            throw new SigningException("Failed to sign request with key " + context.keyId(), e);
        }

        String signatureB64 = Base64.getEncoder().encodeToString(signatureBytes);
        return new SignatureHeaders(
            "keyId=\"" + context.keyId() + "\",algorithm=\"" + ALGORITHM + "\",signature=\"" + signatureB64 + "\"",
            "sig1=();created=" + timestamp,
            timestamp);
    }

    public String keyId() {
        return context.keyId();
    }

    static String canonicalString(String method, String url, String timestamp, String body) {
        StringBuilder content = new StringBuilder()
            .append(method.toUpperCase(Locale.ROOT)).append('\n')
            .append(url).append('\n')
            .append(timestamp);
        if (body != null && !body.isEmpty()) {
            content.append('\n').append(contentDigest(body));
        }
        return content.toString();
    }

    static String contentDigest(String body) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return Base64.getEncoder().encodeToString(sha256.digest(body.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
