package io.openpayments.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UrlsTest {

    @Test
    void trimTrailingSlash() {
        assertEquals("https://auth.example", Urls.trimTrailingSlash("https://auth.example//"));
        assertEquals("https://auth.example/gnap", Urls.trimTrailingSlash(" https://auth.example/gnap "));
        assertThrows(IllegalArgumentException.class, () -> Urls.trimTrailingSlash(""));
    }

    @Test
    void requireAbsoluteHttpUrl() {
        assertEquals("rs.example", Urls.requireAbsoluteHttpUrl("https://rs.example/op/1").getHost());
        assertThrows(IllegalArgumentException.class, () -> Urls.requireAbsoluteHttpUrl("/op/1"));
        assertThrows(IllegalArgumentException.class, () -> Urls.requireAbsoluteHttpUrl("mailto:alice@example.com"));
        assertThrows(IllegalArgumentException.class, () -> Urls.requireAbsoluteHttpUrl("https://rs example/"));
    }

    @Test
    void originOfKeepsSchemeHostAndPort() {
        assertEquals("https://wallet.example", Urls.originOf("https://wallet.example/alice"));
        assertEquals("http://localhost:8080", Urls.originOf("http://localhost:8080/alice?x=1"));
    }
}
