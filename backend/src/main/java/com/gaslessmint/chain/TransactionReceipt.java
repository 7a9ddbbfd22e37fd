package com.gaslessmint.chain;

import java.util.List;

/**
 * Subset of an EVM transaction receipt the mint flow needs. {@code status} is "0x1" on success.
 */
public record TransactionReceipt(String transactionHash, String blockHash, String blockNumber, String status,
                                 List<ReceiptLog> logs) {

    public TransactionReceipt {
        logs = logs != null ? List.copyOf(logs) : List.of();
    }
}
