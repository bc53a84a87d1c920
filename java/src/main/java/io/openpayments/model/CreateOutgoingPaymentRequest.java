package io.openpayments.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Body of {@code POST /outgoing-payments}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateOutgoingPaymentRequest(
    String walletAddress,
    String quoteId,
    Map<String, Object> metadata) {

    public CreateOutgoingPaymentRequest {
        Objects.requireNonNull(walletAddress, "walletAddress");
        Objects.requireNonNull(quoteId, "quoteId");
        metadata = (metadata == null || metadata.isEmpty()) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
