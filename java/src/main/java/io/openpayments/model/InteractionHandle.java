package io.openpayments.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code interact} element of a grant response: the grant waits for the end user
 * to consent at {@code redirectUrl}.
 */
public class InteractionHandle {
    @JsonProperty("redirect")
    public String redirectUrl;

    /** Nonce the server uses to sign the finish redirect. */
    public String finish;

    /** Continuation taken from the same grant response, if the server sent one. */
    @JsonIgnore
    public Continuation continuation;

    /** Default constructor for Jackson. */
    public InteractionHandle() {}

    public InteractionHandle(String redirectUrl, Continuation continuation) {
        this.redirectUrl = redirectUrl;
        this.continuation = continuation;
    }
}
