package io.openpayments.crypto;

import io.openpayments.exception.SigningException;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class Ed25519RequestSignerTest {

    static KeyPair keyPair;

    static final Instant CREATED = Instant.parse("2026-03-01T12:00:00Z");
    static final String URL = "https://auth.example/";
    static final String BODY = "{\"client\":\"https://wallet.example/alice\"}";

    Ed25519RequestSigner signer;

    @BeforeAll
    static void generateKey() throws Exception {
        keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        signer = new Ed25519RequestSigner(new SigningContext("key-1", keyPair.getPrivate()));
    }

    private static boolean verifies(String canonical, SignatureHeaders headers) throws Exception {
        Signature verifier = Signature.getInstance("Ed25519");
        verifier.initVerify(keyPair.getPublic());
        verifier.update(canonical.getBytes(StandardCharsets.UTF_8));
        return verifier.verify(Base64.getDecoder().decode(SignatureHeaders.Parsed.parse(headers.signature()).signature()));
    }

    @Test
    void signatureIsDeterministicForFixedTime() throws Exception {
        SignatureHeaders first = signer.sign("POST", URL, BODY, CREATED);
        SignatureHeaders second = signer.sign("POST", URL, BODY, CREATED);

        assertEquals(first, second);
    }

    @Test
    void clockDrivesTimestamp() throws Exception {
        Ed25519RequestSigner fixed = new Ed25519RequestSigner(
            new SigningContext("key-1", keyPair.getPrivate()), Clock.fixed(CREATED, ZoneOffset.UTC));

        SignatureHeaders headers = fixed.sign("POST", URL, BODY);

        assertEquals("2026-03-01T12:00:00Z", headers.timestamp());
        assertEquals("sig1=();created=2026-03-01T12:00:00Z", headers.signatureInput());
        assertEquals(signer.sign("POST", URL, BODY, CREATED), headers);
    }

    @Test
    void signatureHeaderCarriesKeyIdAndAlgorithm() throws Exception {
        SignatureHeaders.Parsed parsed = SignatureHeaders.Parsed.parse(signer.sign("POST", URL, BODY, CREATED).signature());

        assertEquals("key-1", parsed.keyId());
        assertEquals("ed25519", parsed.algorithm());
        assertEquals(64, Base64.getDecoder().decode(parsed.signature()).length);
    }

    @Test
    void signatureVerifiesOverCanonicalString() throws Exception {
        SignatureHeaders headers = signer.sign("post", URL, BODY, CREATED);

        String canonical = "POST\n" + URL + "\n2026-03-01T12:00:00Z\n" + Ed25519RequestSigner.contentDigest(BODY);
        assertEquals(canonical, Ed25519RequestSigner.canonicalString("post", URL, "2026-03-01T12:00:00Z", BODY));
        assertTrue(verifies(canonical, headers));
    }

    @Test
    void bodyChangeChangesSignature() throws Exception {
        SignatureHeaders original = signer.sign("POST", URL, BODY, CREATED);
        SignatureHeaders tampered = signer.sign("POST", URL, BODY.replace("alice", "alicf"), CREATED);

        assertNotEquals(original.signature(), tampered.signature());
        String canonical = Ed25519RequestSigner.canonicalString("POST", URL, "2026-03-01T12:00:00Z", BODY);
        assertFalse(verifies(canonical, tampered));
    }

    @Test
    void emptyBodyHasNoDigestLine() {
        String expected = "GET\nhttps://rs.example/quotes/q1\n2026-03-01T12:00:00Z";

        assertEquals(expected, Ed25519RequestSigner.canonicalString("GET", "https://rs.example/quotes/q1", "2026-03-01T12:00:00Z", null));
        assertEquals(expected, Ed25519RequestSigner.canonicalString("GET", "https://rs.example/quotes/q1", "2026-03-01T12:00:00Z", ""));
    }

    @Test
    void contentDigestIsBase64Sha256() {
        // sha256("abc")
        assertEquals("ungWv48Bz+pBQUDeXa4iI7ADYaOWF3qctBD/YfIAFa0=", Ed25519RequestSigner.contentDigest("abc"));
    }

    @Test
    void nonEd25519KeyFailsToSign() throws Exception {
        KeyPair rsa = KeyPairGenerator.getInstance("RSA").generateKeyPair();
        Ed25519RequestSigner wrongKey = new Ed25519RequestSigner(new SigningContext("rsa-1", rsa.getPrivate()));

        SigningException ex = assertThrows(SigningException.class, () -> wrongKey.sign("POST", URL, BODY));
        assertTrue(ex.getMessage().contains("rsa-1"));
    }

    @Test
    void signingContextRequiresKeyIdAndHidesKey() {
        assertThrows(IllegalArgumentException.class, () -> new SigningContext(" ", keyPair.getPrivate()));
        assertThrows(NullPointerException.class, () -> new SigningContext("key-1", null));

        String text = new SigningContext("key-1", keyPair.getPrivate()).toString();
        assertTrue(text.contains("key-1"));
        assertFalse(text.contains(Base64.getEncoder().encodeToString(keyPair.getPrivate().getEncoded())));
    }

    @Test
    void keyIdMustBeQuotable() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> new SigningContext("key\"1", keyPair.getPrivate()));
        assertThrows(IllegalArgumentException.class, () -> new SigningContext("key-1\r\nX-Injected: 1", keyPair.getPrivate()));

        Ed25519RequestSigner urlKeyId = new Ed25519RequestSigner(
            new SigningContext("https://wallet.example/alice/jwks.json#key-1", keyPair.getPrivate()));
        SignatureHeaders.Parsed parsed = SignatureHeaders.Parsed.parse(urlKeyId.sign("GET", URL, null, CREATED).signature());
        assertEquals("https://wallet.example/alice/jwks.json#key-1", parsed.keyId());
    }

    @Test
    void malformedSignatureHeaderIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> SignatureHeaders.Parsed.parse("keyId=key-1"));
        assertThrows(IllegalArgumentException.class, () -> SignatureHeaders.Parsed.parse(null));
    }
}
