package io.openpayments.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Body of {@code POST /incoming-payments}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateIncomingPaymentRequest(
    String walletAddress,
    Amount incomingAmount,
    String expiresAt,
    Map<String, Object> metadata) {

    public CreateIncomingPaymentRequest {
        Objects.requireNonNull(walletAddress, "walletAddress");
        Objects.requireNonNull(incomingAmount, "incomingAmount");
        metadata = (metadata == null || metadata.isEmpty()) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
