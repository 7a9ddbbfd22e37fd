package com.gaslessmint.domain;

/**
 * Custodial wallet as reported by the wallet provider. {@code state} is null when the wallet was served
 * from the ledger instead of the provider.
 */
public record Wallet(
        String id,
        String address,
        Blockchain blockchain,
        WalletAccountType accountType,
        WalletState state
) {

    public boolean isSmartContractAccount() {
        return accountType == WalletAccountType.SCA;
    }
}
