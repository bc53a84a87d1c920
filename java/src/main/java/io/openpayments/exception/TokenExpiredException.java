package io.openpayments.exception;

/**
 * Thrown when the Resource Server rejects the access token (HTTP 401).
 * The caller is expected to negotiate a new grant.
 */
public class TokenExpiredException extends HttpStatusException {

    public TokenExpiredException(String responseBody) {
        super(401, responseBody);
    }
}
