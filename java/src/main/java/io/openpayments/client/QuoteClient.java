package io.openpayments.client;

import io.openpayments.model.Amount;
import io.openpayments.model.CreateQuoteRequest;
import io.openpayments.model.Quote;

import java.io.IOException;

/** Contract for creating and reading quotes with signed requests. */
public interface QuoteClient extends AutoCloseable {
    /**
     * Creates a quote towards a receiving wallet. Exactly one amount must be given.
     *
     * @param receiverWallet receiving wallet address URL
     * @param sendAmount amount to send, or {@code null}
     * @param receiveAmount amount the receiver gets, or {@code null}
     * @return the created quote
     * @throws IllegalArgumentException if both or neither amounts are given
     * @throws IOException if the request cannot be signed, fails or is rejected
     * @throws InterruptedException if the request is interrupted
     */
    default Quote createQuote(String receiverWallet, Amount sendAmount, Amount receiveAmount)
            throws IOException, InterruptedException {
        return createQuote(new CreateQuoteRequest(receiverWallet, CreateQuoteRequest.METHOD_ILP, sendAmount, receiveAmount));
    }

    Quote createQuote(CreateQuoteRequest request) throws IOException, InterruptedException;

    /**
     * Reads a quote.
     *
     * @param quoteUrl the quote {@code id} exactly as returned at creation
     */
    Quote getQuote(String quoteUrl) throws IOException, InterruptedException;

    @Override
    void close();
}
