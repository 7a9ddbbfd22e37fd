package com.gaslessmint.domain;

import java.util.Optional;

/**
 * Custodial wallet account type. Only smart contract accounts can receive sponsored gas.
 */
public enum WalletAccountType {
    /** Smart contract account. */
    SCA,
    /** Externally owned account. */
    EOA;

    public static Optional<WalletAccountType> fromProviderValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (WalletAccountType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
