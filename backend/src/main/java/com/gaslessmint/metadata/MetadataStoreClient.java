package com.gaslessmint.metadata;

import com.gaslessmint.domain.NftMetadata;
import reactor.core.publisher.Mono;

/**
 * Content-addressed metadata storage (IPFS pinning service plus gateway).
 */
public interface MetadataStoreClient {

    /**
     * Pins the metadata JSON under a display name.
     *
     * @return content hash (CID)
     */
    Mono<String> pinJson(NftMetadata metadata, String name);

    Mono<NftMetadata> fetch(String uri);
}
