package io.openpayments.crypto;

import java.net.http.HttpRequest;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Authentication headers for one signed request.
 *
 * @param signature value of the {@code Signature} header
 * @param signatureInput value of the {@code Signature-Input} header
 * @param timestamp ISO-8601 UTC creation time covered by the signature
 */
public record SignatureHeaders(String signature, String signatureInput, String timestamp) {

    public static final String SIGNATURE = "Signature";
    public static final String SIGNATURE_INPUT = "Signature-Input";

    public HttpRequest.Builder applyTo(HttpRequest.Builder builder) {
        return builder
            .header(SIGNATURE, signature)
            .header(SIGNATURE_INPUT, signatureInput);
    }

    /** Fields of a {@code Signature} header. */
    public record Parsed(String keyId, String algorithm, String signature) {

        private static final Pattern SIGNATURE_PATTERN = Pattern.compile(
            "^keyId=\"([^\"]+)\",algorithm=\"([^\"]+)\",signature=\"([^\"]+)\"$");

        public static Parsed parse(String header) {
            if (header == null) {
                throw new IllegalArgumentException("Signature header is missing");
            }
            Matcher matcher = SIGNATURE_PATTERN.matcher(header.trim());
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Malformed Signature header: " + header);
            }
            return new Parsed(matcher.group(1), matcher.group(2), matcher.group(3));
        }
    }
}
