package com.gaslessmint.domain;

import java.time.Instant;
import java.util.List;

/**
 * Contract execution accepted by the sponsorship provider but not yet terminal.
 */
public record PendingTransaction(
        String transactionId,
        String walletId,
        String contractAddress,
        String functionSignature,
        List<Object> encodedParameters,
        Blockchain blockchain,
        TransactionState state,
        Instant submittedAt
) {

    public PendingTransaction {
        encodedParameters = encodedParameters != null ? List.copyOf(encodedParameters) : List.of();
    }
}
