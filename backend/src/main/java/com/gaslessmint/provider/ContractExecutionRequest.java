package com.gaslessmint.provider;

import com.gaslessmint.domain.Blockchain;

import java.util.List;

/**
 * Sponsored contract call. {@code amount} is native value in whole units ("0" for none); {@code gasLimit} is the
 * fixed ceiling handed to the provider.
 */
public record ContractExecutionRequest(
        String idempotencyKey,
        String walletId,
        String contractAddress,
        String abiFunctionSignature,
        List<Object> abiParameters,
        Blockchain blockchain,
        String amount,
        String feeLevel,
        String gasLimit
) {

    public ContractExecutionRequest {
        abiParameters = abiParameters != null ? List.copyOf(abiParameters) : List.of();
    }
}
