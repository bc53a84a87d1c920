package io.openpayments.client;

import io.openpayments.model.AccessRight;
import io.openpayments.model.AccessToken;
import io.openpayments.model.GrantResponse;
import io.openpayments.model.InteractionHandle;

import java.io.IOException;
import java.util.List;

/** Contract for negotiating grants with an authorization server. */
public interface GrantClient extends AutoCloseable {
    /**
     * Requests a grant that needs no end-user interaction.
     *
     * @param accessRights rights to request, at least one
     * @param clientId client identifier (usually the client's wallet address)
     * @return a granted response carrying an access token
     * @throws io.openpayments.exception.UnexpectedInteractionException if the server asks for interaction
     * @throws io.openpayments.exception.ProtocolException if the response has neither token nor interaction
     * @throws io.openpayments.exception.HttpStatusException if the server answers with a non-2xx status
     * @throws IOException if the request cannot be signed or sent
     * @throws InterruptedException if the request is interrupted
     */
    GrantResponse requestGrantNonInteractive(List<AccessRight> accessRights, String clientId)
            throws IOException, InterruptedException;

    /**
     * Requests a grant that may need end-user consent through a redirect.
     *
     * @param accessRights rights to request, at least one
     * @param clientId client identifier
     * @param redirectUri where the authorization server sends the user after consent
     * @return either a granted response or one pending interaction
     * @throws io.openpayments.exception.ProtocolException if the response has neither token nor interaction
     * @throws io.openpayments.exception.HttpStatusException if the server answers with a non-2xx status
     * @throws IOException if the request cannot be signed or sent
     * @throws InterruptedException if the request is interrupted
     */
    GrantResponse requestGrantInteractive(List<AccessRight> accessRights, String clientId, String redirectUri)
            throws IOException, InterruptedException;

    /**
     * Finishes a pending interactive grant after the user consented.
     *
     * @param continuationUri continuation URI from the pending grant response
     * @param continuationToken continuation access token from the same response
     * @return a granted response
     * @throws io.openpayments.exception.InvalidContinuationException if no matching interaction is pending
     * @throws io.openpayments.exception.ProtocolException if the response carries no access token
     * @throws io.openpayments.exception.HttpStatusException if the server answers with a non-2xx status
     * @throws IOException if the request fails
     * @throws InterruptedException if the request is interrupted
     */
    default GrantResponse continueGrant(String continuationUri, String continuationToken)
            throws IOException, InterruptedException {
        return continueGrant(continuationUri, continuationToken, null);
    }

    /**
     * Same as {@link #continueGrant(String, String)}, also sending the {@code interact_ref}
     * received on the finish redirect when it is not {@code null}.
     */
    GrantResponse continueGrant(String continuationUri, String continuationToken, String interactRef)
            throws IOException, InterruptedException;

    /**
     * Finishes the pending grant behind an interaction handle.
     *
     * @throws io.openpayments.exception.InvalidContinuationException if the handle has no continuation
     */
    GrantResponse continueGrant(InteractionHandle handle, String interactRef)
            throws IOException, InterruptedException;

    /**
     * Rotates an access token through its manage URL.
     *
     * @return the new access token; the old one is no longer valid
     */
    AccessToken rotateToken(AccessToken token) throws IOException, InterruptedException;

    /** Revokes an access token through its manage URL. */
    void revokeToken(AccessToken token) throws IOException, InterruptedException;

    @Override
    void close();
}
