package io.openpayments.exception;

import java.io.IOException;

/**
 * Base exception for protocol-level failures reported by the Open Payments clients.
 *
 * <p>Transport failures (connection refused, timeouts) surface as the JDK's own
 * {@link IOException}s; anything rejected or malformed at the protocol level is a
 * subclass of this type.
 */
public class OpenPaymentsException extends IOException {

    private final int statusCode;
    private final String responseBody;

    public OpenPaymentsException(String message) {
        this(message, 0, null, null);
    }

    public OpenPaymentsException(String message, Throwable cause) {
        this(message, 0, null, cause);
    }

    public OpenPaymentsException(String message, int statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /** HTTP status of the response that caused this error, or 0 when there was none. */
    public int getStatusCode() {
        return statusCode;
    }

    /** Raw response body, or {@code null} when there was none. */
    public String getResponseBody() {
        return responseBody;
    }
}
