package io.openpayments.model;

/** Quote fixing the amounts and fees of a future outgoing payment. */
public class Quote {
    public String id;
    public String walletAddress;
    public String receiver;
    public Amount sendAmount;
    public Amount debitAmount;
    public Amount receiveAmount;
    public String method;                // "ilp"
    public String expiresAt;
    public String createdAt;
}
