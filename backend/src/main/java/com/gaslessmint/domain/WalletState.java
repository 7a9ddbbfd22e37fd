package com.gaslessmint.domain;

import java.util.Optional;

public enum WalletState {
    LIVE,
    FROZEN;

    public static Optional<WalletState> fromProviderValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (WalletState state : values()) {
            if (state.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
