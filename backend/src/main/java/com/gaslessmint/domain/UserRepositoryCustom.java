package com.gaslessmint.domain;

import java.util.Optional;

public interface UserRepositoryCustom {

    /** Returns the user for the email, inserting it when absent (single upsert). */
    User findOrCreateByEmail(String email);

    /**
     * Sets wallet fields only when the user has no wallet yet.
     *
     * @return user as stored after the call (with the given wallet, or with the wallet that was already there);
     *         empty if the user does not exist
     */
    Optional<User> attachWalletIfAbsent(String userId, Wallet wallet);
}
