package io.openpayments.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.verification.LoggedRequest;
import io.openpayments.crypto.Ed25519RequestSigner;
import io.openpayments.crypto.SignatureHeaders;
import io.openpayments.crypto.SigningContext;
import io.openpayments.exception.HttpStatusException;
import io.openpayments.model.Amount;
import io.openpayments.model.Quote;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Signature;
import java.util.Base64;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

class HttpQuoteClientTest {

    static WireMockServer wm;
    static KeyPair keyPair;

    HttpQuoteClient client;

    @BeforeAll
    static void startServer() throws Exception {
        wm = new WireMockServer(0);   // random port
        wm.start();
        keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
    }

    @AfterAll
    static void stopServer() { wm.stop(); }

    @BeforeEach
    void setUp() {
        wm.resetAll();
        client = HttpQuoteClient.forWallet(baseUrl() + "/alice", signer());
    }

    @AfterEach
    void tearDown() { client.close(); }

    private static String baseUrl() {
        return "http://localhost:" + wm.port();
    }

    private static Ed25519RequestSigner signer() {
        return new Ed25519RequestSigner(new SigningContext("key-1", keyPair.getPrivate()));
    }

    private static boolean verifies(String canonical, String signatureHeader) throws Exception {
        Signature verifier = Signature.getInstance("Ed25519");
        verifier.initVerify(keyPair.getPublic());
        verifier.update(canonical.getBytes(StandardCharsets.UTF_8));
        return verifier.verify(Base64.getDecoder().decode(SignatureHeaders.Parsed.parse(signatureHeader).signature()));
    }

    @Test
    void createQuoteWithSendAmountIsSigned() throws Exception {
        wm.stubFor(post(urlEqualTo("/quotes"))
            .willReturn(aResponse()
                .withStatus(201)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"id\":\"" + baseUrl() + "/quotes/q1\",\"method\":\"ilp\","
                    + "\"sendAmount\":{\"value\":\"1000\",\"assetCode\":\"USD\",\"assetScale\":2},"
                    + "\"debitAmount\":{\"value\":\"1010\",\"assetCode\":\"USD\",\"assetScale\":2},"
                    + "\"receiveAmount\":{\"value\":\"920\",\"assetCode\":\"EUR\",\"assetScale\":2}}")));

        Quote quote = client.createQuote("https://wallet.example/bob", new Amount("1000", "USD", 2), null);

        assertEquals(baseUrl() + "/quotes/q1", quote.id);
        assertEquals(new Amount("1000", "USD", 2), quote.sendAmount);
        assertEquals("1010", quote.debitAmount.value());
        assertEquals("EUR", quote.receiveAmount.assetCode());

        wm.verify(postRequestedFor(urlEqualTo("/quotes"))
            .withHeader("Signature", matching("keyId=\"key-1\",algorithm=\"ed25519\",signature=\".+\""))
            .withHeader("Signature-Input", matching("sig1=\\(\\);created=.+"))
            .withRequestBody(equalToJson("{\"walletAddress\":\"https://wallet.example/bob\",\"method\":\"ilp\","
                + "\"sendAmount\":{\"value\":\"1000\",\"assetCode\":\"USD\",\"assetScale\":2}}")));
    }

    @Test
    void createQuoteWithReceiveAmount() throws Exception {
        wm.stubFor(post(urlEqualTo("/quotes"))
            .willReturn(aResponse()
                .withStatus(201)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"id\":\"" + baseUrl() + "/quotes/q2\"}")));

        client.createQuote("https://wallet.example/bob", null, new Amount("100", "EUR", 2));

        wm.verify(postRequestedFor(urlEqualTo("/quotes"))
            .withRequestBody(equalToJson("{\"walletAddress\":\"https://wallet.example/bob\",\"method\":\"ilp\","
                + "\"receiveAmount\":{\"value\":\"100\",\"assetCode\":\"EUR\",\"assetScale\":2}}")));
    }

    @Test
    void createQuoteNeedsExactlyOneAmount() {
        Amount amount = new Amount("100", "USD", 2);

        assertThrows(IllegalArgumentException.class, () -> client.createQuote("https://wallet.example/bob", null, null));
        assertThrows(IllegalArgumentException.class,
            () -> client.createQuote("https://wallet.example/bob", amount, amount));
        wm.verify(0, postRequestedFor(anyUrl()));
    }

    @Test
    void getQuoteIsSignedWithoutDigest() throws Exception {
        String quoteUrl = baseUrl() + "/quotes/q1";
        wm.stubFor(get(urlEqualTo("/quotes/q1"))
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("{\"id\":\"" + quoteUrl + "\",\"expiresAt\":\"2030-01-01T00:00:00Z\"}")));

        Quote quote = client.getQuote(quoteUrl);

        assertEquals("2030-01-01T00:00:00Z", quote.expiresAt);
        LoggedRequest sent = wm.findAll(getRequestedFor(urlEqualTo("/quotes/q1"))).get(0);
        String created = sent.getHeader("Signature-Input").substring("sig1=();created=".length());
        assertTrue(verifies("GET\n" + quoteUrl + "\n" + created, sent.getHeader("Signature")));
    }

    @Test
    void createQuoteReportsServerErrors() {
        wm.stubFor(post(urlEqualTo("/quotes"))
            .willReturn(aResponse()
                .withStatus(500)
                .withBody("{\"error\":\"internal server error\"}")));

        HttpStatusException ex = assertThrows(HttpStatusException.class,
            () -> client.createQuote("https://wallet.example/bob", new Amount("1", "USD", 2), null));
        assertEquals(500, ex.getStatusCode());
        assertTrue(ex.getMessage().contains("internal server error"));
    }
}
