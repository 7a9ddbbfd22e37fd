package com.gaslessmint.metadata;

/**
 * Pinning failed and stub fallback is disabled (gaslessmint.metadata.fail-on-publish-error=true).
 */
public class MetadataPublishException extends RuntimeException {

    public MetadataPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
