package io.openpayments.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A capability requested from (or granted by) the authorization server.
 *
 * <p>{@code actions} is never empty. {@code identifier} scopes the right to a single
 * resource instance; {@code limits} is passed through to the server untouched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessRight(
    @JsonProperty("type") ResourceType resourceType,
    Set<Action> actions,
    String identifier,
    Map<String, Object> limits) {

    public AccessRight {
        Objects.requireNonNull(resourceType, "resourceType");
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("Access right for " + resourceType.wireName() + " needs at least one action");
        }
        if (actions.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Access right actions must not contain null");
        }
        actions = Collections.unmodifiableSet(new LinkedHashSet<>(actions));
        identifier = (identifier == null || identifier.isBlank()) ? null : identifier;
        limits = (limits == null || limits.isEmpty()) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(limits));
    }

    public static AccessRight of(ResourceType resourceType, Action... actions) {
        return new AccessRight(resourceType, new LinkedHashSet<>(Arrays.asList(actions)), null, null);
    }

    public AccessRight withIdentifier(String identifier) {
        return new AccessRight(resourceType, actions, identifier, limits);
    }

    public AccessRight withLimits(Map<String, Object> limits) {
        return new AccessRight(resourceType, actions, identifier, limits);
    }
}
