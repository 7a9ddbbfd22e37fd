package com.gaslessmint.ledger;

import com.gaslessmint.domain.User;
import com.gaslessmint.domain.UserRepository;
import com.gaslessmint.domain.Wallet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Optional;

/**
 * Durable ledger on MongoDB (gaslessmint.ledger.store=mongo). The unique email index backs the atomic upsert.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoUserStore implements UserStore, InitializingBean {

    private final UserRepository userRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public void afterPropertiesSet() {
        mongoTemplate.indexOps(User.class).ensureIndex(new Index("email", Sort.Direction.ASC).unique());
    }

    @Override
    public Optional<User> findById(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return userRepository.findById(userId);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return userRepository.findByEmail(email);
    }

    @Override
    public User findOrCreate(String email) {
        return userRepository.findOrCreateByEmail(email);
    }

    @Override
    public User attachWalletIfAbsent(String userId, Wallet wallet) {
        return userRepository.attachWalletIfAbsent(userId, wallet)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }
}
