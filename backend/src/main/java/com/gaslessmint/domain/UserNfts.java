package com.gaslessmint.domain;

import java.math.BigInteger;
import java.util.List;

/**
 * Tokens held by one address on the NFT contract of a chain.
 *
 * @param mintCount tokens ever minted to the address (the contract's userMintCount), not the current balance
 */
public record UserNfts(
        Blockchain blockchain,
        String owner,
        BigInteger balance,
        BigInteger mintCount,
        List<OwnedNft> nfts
) {

    public UserNfts {
        nfts = List.copyOf(nfts);
    }

    /**
     * @param error set when the tokenURI lookup failed; tokenUri is then empty
     */
    public record OwnedNft(String tokenId, String tokenUri, String error) {

        public boolean hasError() {
            return error != null;
        }
    }
}
