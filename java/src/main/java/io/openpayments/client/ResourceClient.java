package io.openpayments.client;

import io.openpayments.model.Amount;
import io.openpayments.model.IncomingPayment;
import io.openpayments.model.OutgoingPayment;

import java.io.IOException;
import java.util.Map;

/**
 * Contract for token-authorized operations on a resource server.
 *
 * <p>Every method throws {@link io.openpayments.exception.TokenExpiredException} when the
 * server rejects the token (HTTP 401) and {@link io.openpayments.exception.HttpStatusException}
 * for any other non-2xx status. Nothing is retried.
 */
public interface ResourceClient extends AutoCloseable {
    /**
     * Creates an incoming payment on the receiver's wallet.
     *
     * @param walletAddress receiving wallet address URL
     * @param incomingAmount amount the receiver expects
     * @param expiresAt ISO-8601 expiry, or {@code null}
     * @param metadata free-form metadata, or {@code null}
     * @return the created payment; its {@code id} is the URL to read it back
     * @throws IOException if the request fails or is rejected
     * @throws InterruptedException if the request is interrupted
     */
    IncomingPayment createIncomingPayment(String walletAddress, Amount incomingAmount,
                                          String expiresAt, Map<String, Object> metadata)
            throws IOException, InterruptedException;

    default IncomingPayment createIncomingPayment(String walletAddress, Amount incomingAmount)
            throws IOException, InterruptedException {
        return createIncomingPayment(walletAddress, incomingAmount, null, null);
    }

    /**
     * Creates an outgoing payment from the sender's wallet against an existing quote.
     *
     * @param walletAddress sending wallet address URL
     * @param quoteId full URL of the quote
     * @param metadata free-form metadata, or {@code null}
     * @return the created payment
     * @throws IOException if the request fails or is rejected
     * @throws InterruptedException if the request is interrupted
     */
    OutgoingPayment createOutgoingPayment(String walletAddress, String quoteId, Map<String, Object> metadata)
            throws IOException, InterruptedException;

    /**
     * Reads an incoming payment.
     *
     * @param resourceUrl the payment {@code id} exactly as returned at creation
     */
    IncomingPayment getIncomingPayment(String resourceUrl) throws IOException, InterruptedException;

    /**
     * Reads an outgoing payment.
     *
     * @param resourceUrl the payment {@code id} exactly as returned at creation
     */
    OutgoingPayment getOutgoingPayment(String resourceUrl) throws IOException, InterruptedException;

    @Override
    void close();
}
