package com.gaslessmint.provider;

import lombok.Getter;

/**
 * Wallet provider failure: non-2xx response, transport error or a create call that returned no usable wallet.
 * Fatal for the mint; there is no fallback wallet.
 */
@Getter
public class WalletProviderException extends RuntimeException {

    /** HTTP status of the provider response; 0 when no response was received or the call itself succeeded. */
    private final int httpStatus;

    public WalletProviderException(String message) {
        this(0, message, null);
    }

    public WalletProviderException(int httpStatus, String message, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }
}
