package com.gaslessmint.metadata.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Metadata pinning settings (gaslessmint.metadata.*). Without both API key and secret, publishing uses stub URIs.
 */
@ConfigurationProperties(prefix = "gaslessmint.metadata")
@NoArgsConstructor
@Getter
@Setter
public class MetadataProperties {

    private String pinningUrl = "https://api.pinata.cloud/pinning/pinJSONToIPFS";
    private String pinningApiKey;
    private String pinningSecretKey;
    /** Base every returned URI starts with; the content hash is appended. */
    private String gateway = "https://ipfs.io/ipfs/";
    private long requestTimeoutMs = 30_000;
    /**
     * When true, a pinning failure fails the mint at PUBLISH_METADATA instead of degrading to a stub URI.
     * Unconfigured pinning still uses stubs.
     */
    private boolean failOnPublishError = false;
    /** Tag stored with each pin. */
    private String project = "gasless-nft-minter";

    public boolean isPinningConfigured() {
        return pinningApiKey != null && !pinningApiKey.isBlank()
                && pinningSecretKey != null && !pinningSecretKey.isBlank();
    }
}
