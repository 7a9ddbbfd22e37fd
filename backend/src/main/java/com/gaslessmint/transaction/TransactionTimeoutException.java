package com.gaslessmint.transaction;

import lombok.Getter;

/**
 * No terminal state within the polling budget. The transaction may still confirm later.
 */
@Getter
public class TransactionTimeoutException extends RuntimeException {

    private final String transactionId;
    private final long maxWaitMs;
    private final int polls;

    public TransactionTimeoutException(String transactionId, long maxWaitMs, int polls) {
        super("Transaction " + transactionId + " not terminal after " + maxWaitMs + " ms (" + polls + " polls)");
        this.transactionId = transactionId;
        this.maxWaitMs = maxWaitMs;
        this.polls = polls;
    }
}
