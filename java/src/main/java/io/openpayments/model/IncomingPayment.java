package io.openpayments.model;

import java.util.Map;

/** Incoming payment resource on the receiver's resource server. */
public class IncomingPayment {
    public String id;                    // full resource URL, reused verbatim
    public String walletAddress;
    public Amount incomingAmount;
    public Amount receivedAmount;
    public boolean completed;
    public String expiresAt;             // ISO-8601
    public Map<String, Object> metadata;
    public String createdAt;
    public String updatedAt;
}
