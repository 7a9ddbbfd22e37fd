package com.gaslessmint.provider;

import com.gaslessmint.domain.Blockchain;

import java.util.List;

public record GasEstimateRequest(
        String contractAddress,
        String abiFunctionSignature,
        List<Object> abiParameters,
        Blockchain blockchain
) {

    public GasEstimateRequest {
        abiParameters = abiParameters != null ? List.copyOf(abiParameters) : List.of();
    }
}
