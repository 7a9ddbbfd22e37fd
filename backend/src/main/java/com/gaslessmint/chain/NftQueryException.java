package com.gaslessmint.chain;

/**
 * eth_call on the NFT contract returned data that does not decode as the expected type.
 */
public class NftQueryException extends RuntimeException {

    public NftQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
