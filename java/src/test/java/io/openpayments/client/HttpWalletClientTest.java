package io.openpayments.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import io.openpayments.exception.HttpStatusException;
import io.openpayments.exception.ProtocolException;
import io.openpayments.model.WalletAddress;
import org.junit.jupiter.api.*;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

class HttpWalletClientTest {

    static WireMockServer wm;
    HttpWalletClient client;

    @BeforeAll
    static void startServer() {
        wm = new WireMockServer(0);   // random port
        wm.start();
    }

    @AfterAll
    static void stopServer() { wm.stop(); }

    @BeforeEach
    void setUp() {
        wm.resetAll();
        client = new HttpWalletClient();
    }

    @AfterEach
    void tearDown() { client.close(); }

    @Test
    void getWalletAddressReadsPublicMetadata() throws Exception {
        String wallet = "http://localhost:" + wm.port() + "/alice";
        wm.stubFor(get(urlEqualTo("/alice"))
            .willReturn(aResponse()
                .withHeader("Content-Type", "application/json")
                .withBody("{\"id\":\"" + wallet + "\",\"publicName\":\"Alice\",\"assetCode\":\"USD\","
                    + "\"assetScale\":2,\"authServer\":\"https://auth.example\","
                    + "\"resourceServer\":\"https://rs.example\",\"somethingNew\":true}")));

        WalletAddress info = client.getWalletAddress(wallet);

        assertEquals(wallet, info.id);
        assertEquals("Alice", info.publicName);
        assertEquals(2, info.assetScale);
        assertEquals("https://auth.example", info.authServer);
        assertEquals("https://rs.example", info.resourceServer);
        wm.verify(getRequestedFor(urlEqualTo("/alice"))
            .withHeader("Accept", equalTo("application/json"))
            .withoutHeader("Authorization")
            .withoutHeader("Signature"));
    }

    @Test
    void unknownWalletIsHttpError() {
        wm.stubFor(get(urlEqualTo("/nobody")).willReturn(aResponse().withStatus(404).withBody("not found")));

        HttpStatusException ex = assertThrows(HttpStatusException.class,
            () -> client.getWalletAddress("http://localhost:" + wm.port() + "/nobody"));
        assertEquals(404, ex.getStatusCode());
        assertTrue(ex.getMessage().contains("not found"));
    }

    @Test
    void malformedBodyIsProtocolError() {
        wm.stubFor(get(urlEqualTo("/broken")).willReturn(aResponse().withBody("<html>")));

        assertThrows(ProtocolException.class,
            () -> client.getWalletAddress("http://localhost:" + wm.port() + "/broken"));
    }

    @Test
    void walletAddressMustBeAbsolute() {
        assertThrows(IllegalArgumentException.class, () -> client.getWalletAddress("alice"));
    }
}
