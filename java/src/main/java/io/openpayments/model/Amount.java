package io.openpayments.model;

import java.util.Objects;

/**
 * Amount in the smallest unit of an asset, e.g. {@code ("500", "USD", 2)} is 5.00 USD.
 * All three parts are required; a server amount missing one is rejected.
 */
public record Amount(String value, String assetCode, Integer assetScale) {
    public Amount {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(assetCode, "assetCode");
        Objects.requireNonNull(assetScale, "assetScale");
    }
}
