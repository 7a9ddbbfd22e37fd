package com.gaslessmint.metadata;

import com.gaslessmint.domain.NftMetadata;
import com.gaslessmint.metadata.config.MetadataProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Publishes NFT metadata and returns its retrievable URI. With pinning unconfigured, or on a pinning error,
 * returns a stub URI ({@code <gateway>stub-Qm...}) instead of failing, unless fail-on-publish-error is set.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetadataPublisher {

    static final String STUB_MARKER = "stub-Qm";

    private final MetadataStoreClient storeClient;
    private final MetadataProperties properties;

    public String publish(NftMetadata metadata) {
        if (!properties.isPinningConfigured()) {
            return stubUri(metadata, "pinning not configured");
        }
        String name = metadata.name() + "_metadata.json";
        try {
            String hash = storeClient.pinJson(metadata, name).block();
            if (hash == null) {
                throw new IllegalStateException("Pinning returned no hash");
            }
            String uri = properties.getGateway() + hash;
            log.info("Metadata '{}' pinned: {}", metadata.name(), uri);
            return uri;
        } catch (RuntimeException e) {
            if (properties.isFailOnPublishError()) {
                throw new MetadataPublishException("Pinning metadata '" + metadata.name() + "' failed: " + e.getMessage(), e);
            }
            log.error("Pinning metadata '{}' failed: {}", metadata.name(), e.getMessage());
            return stubUri(metadata, "pinning failed");
        }
    }

    /**
     * Reads metadata back from a gateway URI.
     *
     * @throws MetadataFetchException for stub URIs, unreachable gateways and documents that are not metadata JSON
     */
    public NftMetadata fetch(String uri) {
        if (isStubUri(uri)) {
            throw new MetadataFetchException("Stub metadata URI has no content: " + uri);
        }
        try {
            NftMetadata metadata = storeClient.fetch(uri).block();
            if (metadata == null) {
                throw new MetadataFetchException("Empty metadata document at " + uri);
            }
            return metadata;
        } catch (MetadataFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MetadataFetchException("Fetching metadata from " + uri + " failed: " + e.getMessage(), e);
        }
    }

    public static boolean isStubUri(String uri) {
        return uri != null && uri.contains("/" + STUB_MARKER);
    }

    private String stubUri(NftMetadata metadata, String reason) {
        String uri = properties.getGateway() + STUB_MARKER + UUID.randomUUID().toString().replace("-", "");
        log.warn("[STUB] Metadata '{}' not pinned ({}); using {}", metadata.name(), reason, uri);
        return uri;
    }
}
