package com.gaslessmint.mint;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientStablecoinBalanceException extends RuntimeException {

    private final String walletId;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientStablecoinBalanceException(String walletId, BigDecimal required, BigDecimal available) {
        super("Wallet " + walletId + " holds " + available.toPlainString() + " stablecoin, "
                + required.toPlainString() + " required for metadata storage");
        this.walletId = walletId;
        this.required = required;
        this.available = available;
    }
}
