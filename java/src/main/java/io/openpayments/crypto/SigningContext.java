package io.openpayments.crypto;

import java.security.PrivateKey;
import java.util.Objects;

/**
 * The caller's private key and the id of the matching public key on record with the
 * counterpart server. Read-only; may be shared by concurrent signers.
 */
public record SigningContext(String keyId, PrivateKey privateKey) {

    public SigningContext {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId is required");
        }
        // quoted verbatim in the Signature header
        if (keyId.indexOf('"') >= 0 || keyId.chars().anyMatch(Character::isISOControl)) {
            throw new IllegalArgumentException("keyId must not contain quotes or control characters");
        }
        Objects.requireNonNull(privateKey, "privateKey");
    }

    public static SigningContext fromPem(String keyId, String privateKeyPem) {
        return new SigningContext(keyId, PemKeyLoader.loadPrivateKey(privateKeyPem));
    }

    @Override
    public String toString() {
        return "SigningContext{keyId=" + keyId + ", algorithm=" + privateKey.getAlgorithm() + "}";
    }
}
