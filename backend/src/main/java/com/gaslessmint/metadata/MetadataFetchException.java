package com.gaslessmint.metadata;

public class MetadataFetchException extends RuntimeException {

    public MetadataFetchException(String message) {
        super(message);
    }

    public MetadataFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
