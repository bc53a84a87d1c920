package io.openpayments.util;

import java.net.URI;

/** URL helpers shared by the HTTP clients. */
public final class Urls {
    private Urls() {}

    public static String trimTrailingSlash(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL is required");
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Returns the URL as a URI if it is an absolute http(s) URL.
     *
     * @throws IllegalArgumentException for relative, opaque or non-http(s) URLs
     */
    public static URI requireAbsoluteHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL is required");
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Not a valid URL: " + url, e);
        }
        String scheme = uri.getScheme();
        if (!("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme)) || uri.getRawAuthority() == null) {
            throw new IllegalArgumentException("Expected an absolute http(s) URL but got: " + url);
        }
        return uri;
    }

    /** Scheme, host and port of an absolute URL, e.g. the host serving a wallet address. */
    public static String originOf(String url) {
        URI uri = requireAbsoluteHttpUrl(url);
        return uri.getScheme() + "://" + uri.getRawAuthority();
    }
}
