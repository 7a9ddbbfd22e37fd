package com.gaslessmint.domain;

/**
 * Provider view of a sponsored transaction at one point in time. txHash is always present when state is CONFIRMED.
 */
public record TransactionResult(
        String transactionId,
        TransactionState state,
        String txHash,
        String blockHash,
        Long blockHeight,
        String gasUsed,
        String errorReason
) {}
