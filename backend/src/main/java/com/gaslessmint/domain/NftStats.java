package com.gaslessmint.domain;

import java.math.BigInteger;

/**
 * Supply and identity of the NFT contract on one chain, read from {@code getStats()}, {@code maxSupply()},
 * {@code name()} and {@code symbol()}. currentPrice is in the stablecoin's smallest unit.
 */
public record NftStats(
        Blockchain blockchain,
        String contractAddress,
        String name,
        String symbol,
        BigInteger totalMinted,
        BigInteger remainingSupply,
        BigInteger maxSupply,
        BigInteger currentPrice
) {}
