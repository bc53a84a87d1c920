package io.openpayments.exception;

/**
 * Thrown when a grant continuation is attempted without a matching pending interaction.
 */
public class InvalidContinuationException extends OpenPaymentsException {

    private final String continuationUri;

    public InvalidContinuationException(String continuationUri, String reason) {
        super("Cannot continue grant at " + continuationUri + ": " + reason);
        this.continuationUri = continuationUri;
    }

    public String getContinuationUri() {
        return continuationUri;
    }
}
