package com.gaslessmint.ledger;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class UserWalletLocksTest {

    private final UserWalletLocks locks = new UserWalletLocks();

    @Test
    void withLock_sameKeyIsMutuallyExclusive() throws InterruptedException {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 8; i++) {
            pool.submit(() -> locks.withLock("a@x.com", () -> {
                maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                sleep(10);
                return inside.decrementAndGet();
            }));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void withLock_differentKeysDoNotBlockEachOther() throws InterruptedException {
        CountDownLatch bothInside = new CountDownLatch(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        pool.submit(() -> locks.withLock("a@x.com", () -> await(bothInside)));
        pool.submit(() -> locks.withLock("b@x.com", () -> await(bothInside)));
        pool.shutdown();

        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(bothInside.getCount()).isZero();
    }

    @Test
    void withLock_returnsActionResult() {
        assertThat(locks.withLock("k", () -> "done")).isEqualTo("done");
    }

    private static boolean await(CountDownLatch latch) {
        latch.countDown();
        try {
            return latch.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
