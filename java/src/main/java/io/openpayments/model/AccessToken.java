package io.openpayments.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.openpayments.util.Json;
import io.openpayments.util.LogSanitizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

/**
 * Access token issued by the authorization server.
 *
 * <p>The client exposes {@code expiresInSeconds} but does not track expiry; callers
 * re-negotiate when a resource server answers 401.
 */
@Slf4j
public class AccessToken {

    private static final TypeReference<Map<String, Object>> LIMITS = new TypeReference<>() {};

    /** Opaque bearer secret. Never log it unmasked. */
    public String value;

    /** URL used to rotate or revoke this token. */
    @JsonProperty("manage")
    public String manageUrl;

    /** Seconds until expiry, if the server reported one. */
    @JsonProperty("expires_in")
    public Long expiresInSeconds;

    /** Rights actually granted; may be a subset of what was requested. */
    public List<AccessRight> access = new ArrayList<>();

    /** Default constructor for Jackson. */
    public AccessToken() {}

    public AccessToken(String value, String manageUrl, Long expiresInSeconds, List<AccessRight> access) {
        this.value = value;
        this.manageUrl = manageUrl;
        this.expiresInSeconds = expiresInSeconds;
        this.access = access == null ? new ArrayList<>() : new ArrayList<>(access);
    }

    /**
     * Reads the rights the server reports as granted. Servers may report actions or
     * resource types this client does not model; those are dropped with a warning and
     * never invalidate the token itself.
     */
    @JsonSetter("access")
    void readGrantedAccess(List<JsonNode> granted) {
        List<AccessRight> rights = new ArrayList<>();
        if (granted != null) {
            for (JsonNode node : granted) {
                AccessRight right = grantedRight(node);
                if (right != null) {
                    rights.add(right);
                }
            }
        }
        this.access = rights;
    }

    private static AccessRight grantedRight(JsonNode node) {
        if (node == null || !node.isObject()) {
            log.warn("Ignoring granted access entry that is not an object: {}", node);
            return null;
        }
        ResourceType type;
        try {
            type = ResourceType.fromWireName(node.path("type").asText());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring granted access for unsupported type '{}'", LogSanitizer.sanitize(node.path("type").asText()));
            return null;
        }

        Set<Action> actions = new LinkedHashSet<>();
        for (JsonNode action : node.path("actions")) {
            try {
                actions.add(Action.fromWireName(action.asText()));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unsupported action '{}' granted on {}",
                    LogSanitizer.sanitize(action.asText()), type.wireName());
            }
        }
        if (actions.isEmpty()) {
            log.warn("Ignoring granted access on {} without supported actions", type.wireName());
            return null;
        }

        String identifier = node.hasNonNull("identifier") ? node.get("identifier").asText() : null;
        Map<String, Object> limits = node.hasNonNull("limits") && node.get("limits").isObject()
            ? Json.MAPPER.convertValue(node.get("limits"), LIMITS)
            : null;
        return new AccessRight(type, actions, identifier, limits);
    }

    @Override
    public String toString() {
        return "AccessToken{value=" + LogSanitizer.maskIdentifier(value)
            + ", manageUrl=" + manageUrl
            + ", expiresInSeconds=" + expiresInSeconds
            + ", access=" + access + "}";
    }
}
