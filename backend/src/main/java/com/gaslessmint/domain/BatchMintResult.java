package com.gaslessmint.domain;

import java.util.List;

/**
 * Per-item outcome of a serial batch mint. One failed item never aborts the others.
 */
public record BatchMintResult(
        List<MintResult> successful,
        List<ItemError> errors,
        int totalRequested,
        int totalSuccessful,
        int totalFailed
) {

    public static BatchMintResult of(List<MintResult> successful, List<ItemError> errors, int totalRequested) {
        return new BatchMintResult(List.copyOf(successful), List.copyOf(errors), totalRequested,
                successful.size(), errors.size());
    }

    /**
     * @param stage failing stage, or null when the item was rejected before the workflow started
     */
    public record ItemError(int index, String name, MintStage stage, String message) {}
}
