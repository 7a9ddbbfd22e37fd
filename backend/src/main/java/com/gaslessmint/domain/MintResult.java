package com.gaslessmint.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a completed mint. tokenId is "pending" when the receipt could not be decoded; the mint itself succeeded.
 */
public record MintResult(
        String tokenId,
        String txHash,
        String transactionId,
        String contractAddress,
        String walletAddress,
        WalletAccountType walletAccountType,
        Blockchain blockchain,
        String metadataUri,
        String blockHash,
        Long blockHeight,
        String gasUsed
) {

    /** Every mint goes through the sponsorship provider. */
    @JsonProperty("gasSponsored")
    public boolean gasSponsored() {
        return true;
    }
}
