package com.gaslessmint.domain;

/**
 * Provider gas estimate for a contract call. When the provider could not be asked, {@code estimated} is false,
 * the values are configured defaults and {@code error} says why.
 */
public record GasEstimate(
        Blockchain blockchain,
        String gasLimit,
        String gasPrice,
        String estimatedCost,
        boolean estimated,
        String error
) {

    public static GasEstimate fallback(Blockchain blockchain, String gasLimit, String gasPrice, String estimatedCost,
                                       String error) {
        return new GasEstimate(blockchain, gasLimit, gasPrice, estimatedCost, false, error);
    }
}
