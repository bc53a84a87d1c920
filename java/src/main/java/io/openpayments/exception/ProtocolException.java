package io.openpayments.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Thrown when a server response is malformed or contradicts the protocol,
 * e.g. a grant response with neither an access token nor an interaction handle.
 */
public class ProtocolException extends OpenPaymentsException {

    private final String field;

    public ProtocolException(String message, String field, int statusCode, String responseBody) {
        super(message, statusCode, responseBody, null);
        this.field = field;
    }

    public ProtocolException(String message, int statusCode, String responseBody, Throwable cause) {
        this(message, null, statusCode, responseBody, cause);
    }

    public ProtocolException(String message, String field, int statusCode, String responseBody, Throwable cause) {
        super(message, statusCode, responseBody, cause);
        this.field = field;
    }

    /** Name of the offending field, if one could be identified. */
    public String getField() {
        return field;
    }

    /**
     * Wraps a body Jackson could not read. For well-formed JSON of the wrong shape the
     * offending field is taken from the mapping path, e.g. {@code access_token.expires_in}.
     */
    public static ProtocolException unreadable(String what, int statusCode, String responseBody,
                                               JsonProcessingException cause) {
        if (cause instanceof JsonMappingException && !((JsonMappingException) cause).getPath().isEmpty()) {
            String field = ((JsonMappingException) cause).getPath().stream()
                .map(JsonMappingException.Reference::getFieldName)
                .filter(Objects::nonNull)
                .collect(Collectors.joining("."));
            return new ProtocolException(what + " has an invalid " + field, field.isEmpty() ? null : field,
                statusCode, responseBody, cause);
        }
        return new ProtocolException(what + " is not valid JSON", statusCode, responseBody, cause);
    }

    public static ProtocolException missingGrantOutcome(int statusCode, String responseBody) {
        return new ProtocolException(
            "Grant response carries neither access_token nor interact", "access_token", statusCode, responseBody);
    }
}
