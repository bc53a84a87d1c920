package io.openpayments.model;

import java.util.Map;

/** Outgoing payment resource on the sender's resource server. */
public class OutgoingPayment {
    public String id;                    // full resource URL, reused verbatim
    public String walletAddress;
    public String quoteId;
    public Amount debitAmount;
    public Amount receiveAmount;
    public Amount sentAmount;
    public boolean failed;
    public Map<String, Object> metadata;
    public String createdAt;
    public String updatedAt;
}
