package com.gaslessmint.domain;

/**
 * One token of a collection mint.
 *
 * @param recipient address receiving the token; null or blank means the minting user's wallet
 */
public record CollectionMintItem(NftMetadata metadata, String recipient) {

    public static CollectionMintItem toMinter(NftMetadata metadata) {
        return new CollectionMintItem(metadata, null);
    }

    public boolean hasRecipient() {
        return recipient != null && !recipient.isBlank();
    }
}
