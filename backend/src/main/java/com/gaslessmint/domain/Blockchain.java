package com.gaslessmint.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Chains the wallet and sponsorship provider can mint on. Provider code is the identifier used on the wire
 * (e.g. "ETH-SEPOLIA"); per-chain settings are keyed by provider code.
 */
public enum Blockchain {
    ETH_SEPOLIA("ETH-SEPOLIA", true),
    ETH("ETH", false),
    BASE_SEPOLIA("BASE-SEPOLIA", true),
    BASE("BASE", false),
    MATIC_AMOY("MATIC-AMOY", true),
    MATIC("MATIC", false);

    private final String providerCode;
    private final boolean testnet;

    Blockchain(String providerCode, boolean testnet) {
        this.providerCode = providerCode;
        this.testnet = testnet;
    }

    public String getProviderCode() {
        return providerCode;
    }

    public boolean isTestnet() {
        return testnet;
    }

    /**
     * Accepts either the provider code ("BASE-SEPOLIA") or the enum name ("BASE_SEPOLIA"), case-insensitive.
     */
    public static Optional<Blockchain> fromProviderCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(b -> b.providerCode.equals(normalized) || b.name().equals(normalized))
                .findFirst();
    }
}
