package com.gaslessmint.mint;

import lombok.Getter;

import java.math.BigInteger;

@Getter
public class InsufficientSupplyException extends RuntimeException {

    private final BigInteger remaining;
    private final int requested;

    public InsufficientSupplyException(BigInteger remaining, int requested) {
        super("Only " + remaining + " NFTs remaining, requested " + requested);
        this.remaining = remaining;
        this.requested = requested;
    }
}
