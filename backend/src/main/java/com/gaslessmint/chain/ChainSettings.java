package com.gaslessmint.chain;

import com.gaslessmint.chain.abi.NftContractInterface;
import com.gaslessmint.domain.Blockchain;

/**
 * Resolved, mintable configuration of one chain. {@code stablecoinContractAddress} may be null.
 */
public record ChainSettings(
        Blockchain blockchain,
        String displayName,
        Long chainId,
        String nftContractAddress,
        String stablecoinContractAddress,
        NftContractInterface contractInterface
) {

    public boolean hasStablecoin() {
        return stablecoinContractAddress != null;
    }
}
