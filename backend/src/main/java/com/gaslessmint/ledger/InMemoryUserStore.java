package com.gaslessmint.ledger;

import com.gaslessmint.domain.User;
import com.gaslessmint.domain.Wallet;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local ledger. Lost on restart; used for development and tests (gaslessmint.ledger.store=memory).
 */
@Slf4j
public class InMemoryUserStore implements UserStore {

    private final ConcurrentHashMap<String, User> usersById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> userIdsByEmail = new ConcurrentHashMap<>();

    @Override
    public Optional<User> findById(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(usersById.get(userId)).map(User::copy);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(userIdsByEmail.get(email)).flatMap(this::findById);
    }

    @Override
    public User findOrCreate(String email) {
        String userId = userIdsByEmail.computeIfAbsent(email, e -> {
            Instant now = Instant.now();
            User user = new User();
            user.setId(UUID.randomUUID().toString());
            user.setEmail(e);
            user.setCreatedAt(now);
            user.setUpdatedAt(now);
            usersById.put(user.getId(), user);
            log.info("User created: {} ({})", user.getId(), e);
            return user.getId();
        });
        return usersById.get(userId).copy();
    }

    @Override
    public User attachWalletIfAbsent(String userId, Wallet wallet) {
        User stored = usersById.computeIfPresent(userId, (id, current) -> {
            if (current.hasWallet()) {
                return current;
            }
            User updated = current.copy();
            updated.setWalletId(wallet.id());
            updated.setWalletAddress(wallet.address());
            updated.setWalletBlockchain(wallet.blockchain());
            updated.setWalletAccountType(wallet.accountType());
            updated.setUpdatedAt(Instant.now());
            return updated;
        });
        if (stored == null) {
            throw new UserNotFoundException(userId);
        }
        return stored.copy();
    }
}
