package com.gaslessmint.domain;

/**
 * Sponsored transaction lifecycle as reported by the provider. CONFIRMED is the success terminal;
 * FAILED, DENIED and CANCELLED are failure terminals. Anything else means "keep waiting".
 */
public enum TransactionState {
    INITIATED,
    PENDING_RISK_SCREENING,
    DENIED,
    QUEUED,
    SENT,
    CONFIRMED,
    FAILED,
    CANCELLED,
    /** Provider returned a state this service does not know; treated as non-terminal. */
    UNKNOWN;

    public boolean isTerminal() {
        return this == CONFIRMED || isFailure();
    }

    public boolean isFailure() {
        return this == FAILED || this == DENIED || this == CANCELLED;
    }

    public static TransactionState fromProviderValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
