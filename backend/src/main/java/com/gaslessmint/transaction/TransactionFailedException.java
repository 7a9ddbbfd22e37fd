package com.gaslessmint.transaction;

import com.gaslessmint.domain.TransactionState;
import lombok.Getter;

/**
 * Transaction reached a failure terminal (FAILED, DENIED or CANCELLED).
 */
@Getter
public class TransactionFailedException extends RuntimeException {

    private final String transactionId;
    private final TransactionState state;
    private final String reason;

    public TransactionFailedException(String transactionId, TransactionState state, String reason) {
        super("Transaction " + transactionId + " " + state + (reason != null ? ": " + reason : ""));
        this.transactionId = transactionId;
        this.state = state;
        this.reason = reason;
    }
}
