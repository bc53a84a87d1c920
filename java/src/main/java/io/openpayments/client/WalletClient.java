package io.openpayments.client;

import io.openpayments.model.WalletAddress;

import java.io.IOException;

/** Contract for reading public wallet address metadata. */
public interface WalletClient extends AutoCloseable {
    /**
     * Fetches the public metadata of a wallet address. No authentication is sent.
     *
     * @param walletAddressUrl wallet address URL
     * @return wallet metadata, including its authorization and resource servers
     * @throws IOException if the request fails or returns a non-2xx status
     * @throws InterruptedException if the request is interrupted
     */
    WalletAddress getWalletAddress(String walletAddressUrl) throws IOException, InterruptedException;

    @Override
    void close();
}
