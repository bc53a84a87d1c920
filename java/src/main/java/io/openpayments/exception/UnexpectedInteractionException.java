package io.openpayments.exception;

/**
 * Thrown when a non-interactive grant request is answered with an interaction handle.
 * Recover by switching to the interactive flow.
 */
public class UnexpectedInteractionException extends OpenPaymentsException {

    private final String redirectUrl;

    public UnexpectedInteractionException(String redirectUrl) {
        super("Authorization server requires user interaction for a non-interactive grant");
        this.redirectUrl = redirectUrl;
    }

    public String getRedirectUrl() {
        return redirectUrl;
    }
}
