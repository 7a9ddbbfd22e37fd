package com.gaslessmint.wallet;

import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.TokenBalance;
import com.gaslessmint.domain.User;
import com.gaslessmint.domain.Wallet;
import com.gaslessmint.domain.WalletAccountType;
import com.gaslessmint.ledger.UserNotFoundException;
import com.gaslessmint.ledger.UserStore;
import com.gaslessmint.ledger.UserWalletLocks;
import com.gaslessmint.provider.WalletApiClient;
import com.gaslessmint.provider.WalletProviderException;
import com.gaslessmint.provider.config.ProviderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Provisions at most one custodial wallet per user.
 * <p>
 * A user that already has a wallet gets it back from the ledger without calling the provider, whatever chain
 * is asked for and without re-checking its account type. Creation runs under the per-user lock and is
 * committed with an attach-if-absent write; if another process won the race its wallet is returned and ours
 * is left orphaned at the provider (logged).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WalletProvisioningService {

    private final UserStore userStore;
    private final UserWalletLocks userWalletLocks;
    private final WalletApiClient walletApiClient;
    private final ProviderProperties providerProperties;

    /**
     * @throws UserNotFoundException   if the user id is unknown
     * @throws WalletProviderException if the provider fails or returns no wallet for the chain
     */
    public Wallet ensureWallet(String userId, Blockchain preferredChain) {
        User user = requireUser(userId);
        if (user.hasWallet()) {
            return user.toWallet();
        }
        return userWalletLocks.withLock(user.getEmail(), () -> {
            User current = requireUser(userId);
            if (current.hasWallet()) {
                return current.toWallet();
            }
            Wallet created = createWallet(preferredChain);
            User stored = userStore.attachWalletIfAbsent(userId, created);
            if (!created.id().equals(stored.getWalletId())) {
                log.warn("User {} got wallet {} concurrently; wallet {} left unused", userId,
                        stored.getWalletId(), created.id());
                return stored.toWallet();
            }
            log.info("Wallet {} ({}) attached to user {}", created.id(), created.address(), userId);
            return created;
        });
    }

    public Wallet fetchWallet(String walletId) {
        Wallet wallet = walletApiClient.getWallet(walletId).block();
        if (wallet == null) {
            throw new WalletProviderException("Wallet provider returned no wallet for " + walletId);
        }
        return wallet;
    }

    public List<TokenBalance> getBalances(String walletId) {
        List<TokenBalance> balances = walletApiClient.getBalances(walletId).block();
        return balances != null ? balances : List.of();
    }

    private Wallet createWallet(Blockchain chain) {
        WalletAccountType requested = providerProperties.getAccountType();
        List<Wallet> wallets = walletApiClient.createWallets(1, requested, List.of(chain),
                providerProperties.getWalletSetId()).block();
        if (wallets == null || wallets.isEmpty()) {
            throw new WalletProviderException("Wallet provider created no wallet on " + chain.getProviderCode());
        }
        Wallet wallet = wallets.stream()
                .filter(w -> w.blockchain() == chain)
                .findFirst()
                .orElseThrow(() -> new WalletProviderException(
                        "Wallet provider returned no wallet on " + chain.getProviderCode()));
        if (!wallet.isSmartContractAccount()) {
            // sponsorship provider decides whether it can pay gas for this wallet
            log.warn("Wallet {} is {} not SCA; sponsored gas may be rejected", wallet.id(), wallet.accountType());
        }
        return wallet;
    }

    private User requireUser(String userId) {
        return userStore.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
    }
}
