package com.gaslessmint.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a single batchMint transaction. tokenIds is empty when the batch event could not be decoded.
 */
public record CollectionMintResult(
        List<String> tokenIds,
        String txHash,
        String transactionId,
        String contractAddress,
        String walletAddress,
        Blockchain blockchain,
        List<String> recipients,
        List<String> metadataUris
) {

    @JsonProperty("gasSponsored")
    public boolean gasSponsored() {
        return true;
    }
}
