package io.openpayments.crypto;

import java.nio.charset.StandardCharsets;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/** Parses Ed25519 keys from PEM text (PKCS#8 private, X.509 public). */
public final class PemKeyLoader {
    private PemKeyLoader() {}

    public static PrivateKey loadPrivateKey(String pem) {
        try {
            byte[] der = decode(pem, "PRIVATE KEY");
            return KeyFactory.getInstance("Ed25519").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (NoSuchAlgorithmException | InvalidKeySpecException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to parse Ed25519 private key from PEM", e);
        }
    }

    public static PublicKey loadPublicKey(String pem) {
        try {
            byte[] der = decode(pem, "PUBLIC KEY");
            return KeyFactory.getInstance("Ed25519").generatePublic(new X509EncodedKeySpec(der));
        } catch (NoSuchAlgorithmException | InvalidKeySpecException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to parse Ed25519 public key from PEM", e);
        }
    }

    public static String toPem(PrivateKey key) {
        return encode(key.getEncoded(), "PRIVATE KEY");
    }

    public static String toPem(PublicKey key) {
        return encode(key.getEncoded(), "PUBLIC KEY");
    }

    private static byte[] decode(String pem, String type) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException("PEM text is empty");
        }
        String content = pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replaceAll("\\s+", "");
        return Base64.getDecoder().decode(content.getBytes(StandardCharsets.US_ASCII));
    }

    private static String encode(byte[] der, String type) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
    }
}
