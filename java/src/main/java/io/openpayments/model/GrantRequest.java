package io.openpayments.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Body of a grant request sent to the authorization server.
 * An {@code interact} element is present only for the interactive flow.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GrantRequest(
    @JsonProperty("access_token") List<AccessRight> accessRights,
    @JsonProperty("client") String clientId,
    Interact interact) {

    public GrantRequest {
        if (accessRights == null || accessRights.isEmpty()) {
            throw new IllegalArgumentException("A grant request needs at least one access right");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        accessRights = List.copyOf(accessRights);
    }

    public static GrantRequest nonInteractive(List<AccessRight> accessRights, String clientId) {
        return new GrantRequest(accessRights, clientId, null);
    }

    public static GrantRequest interactive(List<AccessRight> accessRights, String clientId,
                                           String redirectUri, String nonce) {
        return new GrantRequest(accessRights, clientId, Interact.redirect(redirectUri, nonce));
    }

    @JsonIgnore
    public boolean isInteractive() {
        return interact != null;
    }

    /** How the client can start and finish an interaction. */
    public record Interact(List<String> start, Finish finish) {
        public static Interact redirect(String redirectUri, String nonce) {
            return new Interact(List.of("redirect"), new Finish("redirect", redirectUri, nonce));
        }
    }

    /** Where the authorization server sends the user back, bound by {@code nonce}. */
    public record Finish(String method, String uri, String nonce) {
        public Finish {
            Objects.requireNonNull(method, "method");
            if (uri == null || uri.isBlank()) {
                throw new IllegalArgumentException("redirectUri is required for an interactive grant");
            }
            if (nonce == null || nonce.isBlank()) {
                throw new IllegalArgumentException("nonce is required for an interactive grant");
            }
        }
    }
}
