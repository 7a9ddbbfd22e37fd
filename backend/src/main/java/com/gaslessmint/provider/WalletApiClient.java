package com.gaslessmint.provider;

import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.TokenBalance;
import com.gaslessmint.domain.Wallet;
import com.gaslessmint.domain.WalletAccountType;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Custodial wallet API. Errors surface as {@link WalletProviderException} or {@link MalformedProviderResponseException}.
 */
public interface WalletApiClient {

    /**
     * Creates {@code count} wallets of the given type in the wallet set, one per requested chain.
     */
    Mono<List<Wallet>> createWallets(int count, WalletAccountType accountType, List<Blockchain> blockchains, String walletSetId);

    Mono<Wallet> getWallet(String walletId);

    Mono<List<TokenBalance>> getBalances(String walletId);
}
