package com.gaslessmint.ledger;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per user key so two first-mint requests for the same email never provision two wallets in this process.
 * Weak values: a lock is collected once no thread holds a reference to it.
 */
public class UserWalletLocks {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    public <T> T withLock(String userKey, Supplier<T> action) {
        ReentrantLock lock = locks.get(userKey);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
