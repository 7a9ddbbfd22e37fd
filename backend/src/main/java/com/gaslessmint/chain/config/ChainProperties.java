package com.gaslessmint.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-chain settings and chain RPC limits (gaslessmint.chain.*). Network key = Blockchain enum name
 * (e.g. ETH_SEPOLIA, BASE_SEPOLIA).
 */
@ConfigurationProperties(prefix = "gaslessmint.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    private Map<String, NetworkEntry> networks = new HashMap<>();

    /** Chain RPC budget (requests per second) for this service instance, across all chains. */
    private int rpcMaxRequestsPerSecond = 25;

    /** How long the local limiter may wait for a permit before failing the call. */
    private long rpcLimiterTimeoutMs = 2_000;

    /** Per-call timeout for chain RPC. */
    private long rpcTimeoutMs = 15_000;

    private Abi abi = new Abi();

    public void setNetworks(Map<String, NetworkEntry> networks) {
        this.networks = networks != null ? networks : new HashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class NetworkEntry {

        private String displayName;
        private Long chainId;
        private List<String> rpcUrls = new ArrayList<>();
        /** Deployed gasless NFT contract. Missing or zero address → chain is not mintable. */
        private String nftContractAddress;
        /** Stablecoin (e.g. USDC) used for the optional metadata storage fee. */
        private String stablecoinContractAddress;

        public void setRpcUrls(List<String> rpcUrls) {
            this.rpcUrls = rpcUrls != null ? rpcUrls : new ArrayList<>();
        }
    }

    /**
     * Contract ABI names shared by every chain.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Abi {

        private String mintFunction = "mint(address,string)";
        private String batchMintFunction = "batchMint(address[],string[])";
        private String mintEvent = "NFTMinted";
        private String batchMintEvent = "BatchMinted";
    }
}
