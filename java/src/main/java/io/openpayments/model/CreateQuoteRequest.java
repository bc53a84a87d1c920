package io.openpayments.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Body of {@code POST /quotes}. Exactly one of {@code sendAmount} and
 * {@code receiveAmount} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateQuoteRequest(
    String walletAddress,
    String method,
    Amount sendAmount,
    Amount receiveAmount) {

    public static final String METHOD_ILP = "ilp";

    public CreateQuoteRequest {
        Objects.requireNonNull(walletAddress, "walletAddress");
        Objects.requireNonNull(method, "method");
        if ((sendAmount == null) == (receiveAmount == null)) {
            throw new IllegalArgumentException("Exactly one of sendAmount or receiveAmount must be given");
        }
    }

    public static CreateQuoteRequest fixedSend(String walletAddress, Amount sendAmount) {
        return new CreateQuoteRequest(walletAddress, METHOD_ILP, sendAmount, null);
    }

    public static CreateQuoteRequest fixedReceive(String walletAddress, Amount receiveAmount) {
        return new CreateQuoteRequest(walletAddress, METHOD_ILP, null, receiveAmount);
    }
}
