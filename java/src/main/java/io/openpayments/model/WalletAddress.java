package io.openpayments.model;

/** Public metadata served at a wallet address URL. */
public class WalletAddress {
    public String id;
    public String publicName;
    public String assetCode;
    public Integer assetScale;
    public String authServer;
    public String resourceServer;
}
