package com.gaslessmint.chain;

import com.gaslessmint.domain.Blockchain;
import lombok.Getter;

/**
 * Chain has no usable configuration (no NFT contract, or no RPC endpoint).
 */
@Getter
public class UnsupportedChainException extends RuntimeException {

    private final Blockchain blockchain;

    public UnsupportedChainException(Blockchain blockchain, String message) {
        super(message);
        this.blockchain = blockchain;
    }
}
