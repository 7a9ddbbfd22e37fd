package com.gaslessmint.wallet;

import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.User;
import com.gaslessmint.domain.Wallet;
import com.gaslessmint.domain.WalletAccountType;
import com.gaslessmint.domain.WalletState;
import com.gaslessmint.ledger.InMemoryUserStore;
import com.gaslessmint.ledger.UserNotFoundException;
import com.gaslessmint.ledger.UserWalletLocks;
import com.gaslessmint.provider.WalletApiClient;
import com.gaslessmint.provider.WalletProviderException;
import com.gaslessmint.provider.config.ProviderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalletProvisioningServiceTest {

    private static final Wallet SEPOLIA_WALLET = new Wallet("w-1", "0xabc0000000000000000000000000000000000001",
            Blockchain.ETH_SEPOLIA, WalletAccountType.SCA, WalletState.LIVE);

    @Mock
    WalletApiClient walletApiClient;

    private InMemoryUserStore userStore;
    private WalletProvisioningService service;

    @BeforeEach
    void setUp() {
        ProviderProperties properties = new ProviderProperties();
        properties.setWalletSetId("set-1");
        userStore = new InMemoryUserStore();
        service = new WalletProvisioningService(userStore, new UserWalletLocks(), walletApiClient, properties);
    }

    @Test
    @DisplayName("first call creates one SCA wallet and stores it on the user")
    void ensureWallet_createsAndAttaches() {
        User user = userStore.findOrCreate("a@x.com");
        when(walletApiClient.createWallets(eq(1), eq(WalletAccountType.SCA), eq(List.of(Blockchain.ETH_SEPOLIA)), eq("set-1")))
                .thenReturn(Mono.just(List.of(SEPOLIA_WALLET)));

        Wallet wallet = service.ensureWallet(user.getId(), Blockchain.ETH_SEPOLIA);

        assertThat(wallet).isEqualTo(SEPOLIA_WALLET);
        User stored = userStore.findById(user.getId()).orElseThrow();
        assertThat(stored.getWalletId()).isEqualTo("w-1");
        assertThat(stored.getWalletAddress()).isEqualTo(SEPOLIA_WALLET.address());
        assertThat(stored.getWalletAccountType()).isEqualTo(WalletAccountType.SCA);
    }

    @Test
    @DisplayName("user with a wallet gets it back without a provider call, even for another chain")
    void ensureWallet_reusesStoredWallet() {
        User user = userStore.findOrCreate("a@x.com");
        userStore.attachWalletIfAbsent(user.getId(), SEPOLIA_WALLET);

        Wallet wallet = service.ensureWallet(user.getId(), Blockchain.BASE_SEPOLIA);

        assertThat(wallet.id()).isEqualTo("w-1");
        assertThat(wallet.blockchain()).isEqualTo(Blockchain.ETH_SEPOLIA);
        verify(walletApiClient, never()).createWallets(anyInt(), any(), anyList(), any());
    }

    @Test
    void ensureWallet_eoaIsAcceptedWithWarning() {
        User user = userStore.findOrCreate("a@x.com");
        Wallet eoa = new Wallet("w-eoa", "0xeoa0000000000000000000000000000000000001",
                Blockchain.ETH_SEPOLIA, WalletAccountType.EOA, WalletState.LIVE);
        when(walletApiClient.createWallets(anyInt(), any(), anyList(), any())).thenReturn(Mono.just(List.of(eoa)));

        Wallet wallet = service.ensureWallet(user.getId(), Blockchain.ETH_SEPOLIA);

        assertThat(wallet.accountType()).isEqualTo(WalletAccountType.EOA);
        assertThat(userStore.findById(user.getId()).orElseThrow().getWalletId()).isEqualTo("w-eoa");
    }

    @Test
    void ensureWallet_emptyCreateResponseFails() {
        User user = userStore.findOrCreate("a@x.com");
        when(walletApiClient.createWallets(anyInt(), any(), anyList(), any())).thenReturn(Mono.just(List.of()));

        assertThatThrownBy(() -> service.ensureWallet(user.getId(), Blockchain.ETH_SEPOLIA))
                .isInstanceOf(WalletProviderException.class);
        assertThat(userStore.findById(user.getId()).orElseThrow().hasWallet()).isFalse();
    }

    @Test
    void ensureWallet_walletOnOtherChainOnlyFails() {
        User user = userStore.findOrCreate("a@x.com");
        Wallet base = new Wallet("w-2", "0xbase000000000000000000000000000000000001",
                Blockchain.BASE_SEPOLIA, WalletAccountType.SCA, WalletState.LIVE);
        when(walletApiClient.createWallets(anyInt(), any(), anyList(), any())).thenReturn(Mono.just(List.of(base)));

        assertThatThrownBy(() -> service.ensureWallet(user.getId(), Blockchain.ETH_SEPOLIA))
                .isInstanceOf(WalletProviderException.class)
                .hasMessageContaining("ETH-SEPOLIA");
    }

    @Test
    void ensureWallet_providerErrorPropagates() {
        User user = userStore.findOrCreate("a@x.com");
        when(walletApiClient.createWallets(anyInt(), any(), anyList(), any()))
                .thenReturn(Mono.error(new WalletProviderException(401, "Unauthorized", null)));

        assertThatThrownBy(() -> service.ensureWallet(user.getId(), Blockchain.ETH_SEPOLIA))
                .isInstanceOf(WalletProviderException.class)
                .satisfies(e -> assertThat(((WalletProviderException) e).getHttpStatus()).isEqualTo(401));
    }

    @Test
    void ensureWallet_unknownUser() {
        assertThatThrownBy(() -> service.ensureWallet("missing", Blockchain.ETH_SEPOLIA))
                .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    @DisplayName("concurrent first calls for one user create exactly one wallet")
    void ensureWallet_concurrentCallsCreateOnce() throws Exception {
        User user = userStore.findOrCreate("a@x.com");
        when(walletApiClient.createWallets(anyInt(), any(), anyList(), any()))
                .thenReturn(Mono.fromCallable(() -> {
                    Thread.sleep(50);
                    return List.of(SEPOLIA_WALLET);
                }));

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Wallet>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return service.ensureWallet(user.getId(), Blockchain.ETH_SEPOLIA);
                }));
            }
            start.countDown();
            for (Future<Wallet> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS).id()).isEqualTo("w-1");
            }
        } finally {
            pool.shutdownNow();
        }
        verify(walletApiClient, times(1)).createWallets(anyInt(), any(), anyList(), any());
    }

    @Test
    @DisplayName("wallet attached elsewhere during creation wins; the new one is left unused")
    void ensureWallet_raceLoserReturnsStoredWallet() {
        User user = userStore.findOrCreate("a@x.com");
        Wallet other = new Wallet("w-other", "0xother00000000000000000000000000000000001",
                Blockchain.ETH_SEPOLIA, WalletAccountType.SCA, null);
        when(walletApiClient.createWallets(anyInt(), any(), anyList(), any()))
                .thenReturn(Mono.fromCallable(() -> {
                    userStore.attachWalletIfAbsent(user.getId(), other);
                    return List.of(SEPOLIA_WALLET);
                }));

        Wallet wallet = service.ensureWallet(user.getId(), Blockchain.ETH_SEPOLIA);

        assertThat(wallet.id()).isEqualTo("w-other");
        assertThat(userStore.findById(user.getId()).orElseThrow().getWalletId()).isEqualTo("w-other");
    }
}
