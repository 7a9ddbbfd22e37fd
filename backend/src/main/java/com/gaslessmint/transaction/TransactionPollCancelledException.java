package com.gaslessmint.transaction;

import lombok.Getter;

/**
 * Polling thread was interrupted (enclosing request cancelled). The interrupt flag is restored before throwing.
 */
@Getter
public class TransactionPollCancelledException extends RuntimeException {

    private final String transactionId;

    public TransactionPollCancelledException(String transactionId, Throwable cause) {
        super("Polling cancelled for transaction " + transactionId, cause);
        this.transactionId = transactionId;
    }
}
