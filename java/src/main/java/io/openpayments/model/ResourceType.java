package io.openpayments.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Resource types an access right can be requested for. */
public enum ResourceType {
    INCOMING_PAYMENT("incoming-payment"),
    QUOTE("quote"),
    OUTGOING_PAYMENT("outgoing-payment");

    private final String wireName;

    ResourceType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ResourceType fromWireName(String value) {
        for (ResourceType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown resource type: " + value);
    }
}
