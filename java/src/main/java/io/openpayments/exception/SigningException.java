package io.openpayments.exception;

/**
 * Thrown when the configured key cannot produce a request signature.
 */
public class SigningException extends OpenPaymentsException {

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
