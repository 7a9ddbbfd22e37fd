package com.gaslessmint.provider;

import lombok.Getter;

/**
 * Sponsorship (transaction) API failure. Fatal for the current attempt; never resubmitted automatically.
 */
@Getter
public class SponsorshipApiException extends RuntimeException {

    /** HTTP status of the provider response; 0 for transport failures (timeout, connection refused). */
    private final int httpStatus;
    private final String providerMessage;

    public SponsorshipApiException(int httpStatus, String providerMessage) {
        this(httpStatus, providerMessage, null);
    }

    public SponsorshipApiException(int httpStatus, String providerMessage, Throwable cause) {
        super(httpStatus > 0
                ? "Sponsorship API returned " + httpStatus + ": " + providerMessage
                : "Sponsorship API unreachable: " + providerMessage, cause);
        this.httpStatus = httpStatus;
        this.providerMessage = providerMessage;
    }

    public boolean isTransportFailure() {
        return httpStatus == 0;
    }
}
