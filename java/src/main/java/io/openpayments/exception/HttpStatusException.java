package io.openpayments.exception;

/**
 * Thrown when an endpoint answers with a non-2xx status.
 */
public class HttpStatusException extends OpenPaymentsException {

    public HttpStatusException(int statusCode, String responseBody) {
        super("HTTP " + statusCode + ": " + responseBody, statusCode, responseBody, null);
    }
}
