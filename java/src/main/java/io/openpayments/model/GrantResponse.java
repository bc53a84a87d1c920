package io.openpayments.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON returned by the authorization server for a grant or continuation request.
 * Carries either an access token or an interaction handle.
 */
public class GrantResponse {
    @JsonProperty("access_token")
    public AccessToken accessToken;

    public InteractionHandle interact;

    @JsonProperty("continue")
    public Continuation continuation;

    @JsonProperty("instance_id")
    public String instanceId;

    /** GRANTED when a token is present, PENDING_INTERACTION when only a handle is. */
    @JsonIgnore
    public GrantState getState() {
        if (accessToken != null) {
            return GrantState.GRANTED;
        }
        return interact != null ? GrantState.PENDING_INTERACTION : GrantState.FAILED;
    }

    @JsonIgnore
    public boolean isGranted() {
        return getState() == GrantState.GRANTED;
    }

    @JsonIgnore
    public boolean requiresInteraction() {
        return getState() == GrantState.PENDING_INTERACTION;
    }
}
