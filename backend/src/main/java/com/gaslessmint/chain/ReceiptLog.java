package com.gaslessmint.chain;

import java.util.List;

/**
 * One receipt log entry as returned by eth_getTransactionReceipt.
 */
public record ReceiptLog(String address, List<String> topics, String data) {

    public ReceiptLog {
        topics = topics != null ? List.copyOf(topics) : List.of();
    }
}
