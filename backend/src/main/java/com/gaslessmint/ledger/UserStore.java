package com.gaslessmint.ledger;

import com.gaslessmint.domain.User;
import com.gaslessmint.domain.Wallet;

import java.util.Optional;

/**
 * User→wallet ledger. Implementations must make {@link #findOrCreate} and {@link #attachWalletIfAbsent}
 * atomic per key; returned users are snapshots, mutating them does not change the store.
 */
public interface UserStore {

    Optional<User> findById(String userId);

    Optional<User> findByEmail(String email);

    /**
     * Returns the user for the (already normalized) email, creating it on first use.
     */
    User findOrCreate(String email);

    /**
     * Compare-and-set: attaches the wallet only when the user has none.
     *
     * @return the stored user after the call; its wallet is either the given one or the one that was already attached
     * @throws UserNotFoundException if no user has this id
     */
    User attachWalletIfAbsent(String userId, Wallet wallet);
}
