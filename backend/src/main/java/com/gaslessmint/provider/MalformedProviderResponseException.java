package com.gaslessmint.provider;

/**
 * Provider answered 2xx but the body is not the expected shape (not JSON, missing id, CONFIRMED without txHash).
 * Kept apart from provider-reported failures so callers can tell a contract break from a rejected request.
 */
public class MalformedProviderResponseException extends RuntimeException {

    public MalformedProviderResponseException(String message) {
        super(message);
    }

    public MalformedProviderResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
