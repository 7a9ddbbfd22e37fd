package com.gaslessmint.mint;

import com.gaslessmint.domain.MintStage;
import lombok.Getter;

/**
 * Uniform failure of the mint workflow: the stage that failed plus the underlying error as cause.
 * Side effects of earlier stages (wallet, pinned metadata) are kept.
 */
@Getter
public class MintFailedException extends RuntimeException {

    private final MintStage stage;

    public MintFailedException(MintStage stage, Throwable cause) {
        super("Mint failed at " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }
}
