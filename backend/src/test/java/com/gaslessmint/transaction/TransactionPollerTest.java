package com.gaslessmint.transaction;

import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.TransactionResult;
import com.gaslessmint.domain.TransactionState;
import com.gaslessmint.provider.SponsorshipApiClient;
import com.gaslessmint.provider.SponsorshipApiException;
import com.gaslessmint.transaction.config.PollingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionPollerTest {

    private static final String TX_ID = "tx-1";

    @Mock
    SponsorshipApiClient sponsorshipApiClient;

    private TransactionPoller poller;

    @BeforeEach
    void setUp() {
        PollingProperties properties = new PollingProperties();
        properties.setMaxWaitMs(5_000);
        properties.setPollIntervalMs(20);
        poller = new TransactionPoller(sponsorshipApiClient, properties);
    }

    @Test
    @DisplayName("Sent, Sent, Confirmed → returns the confirmed result without waiting for timeout")
    void await_returnsOnConfirmed() {
        when(sponsorshipApiClient.getTransaction(TX_ID)).thenReturn(
                Mono.just(state(TransactionState.SENT)),
                Mono.just(state(TransactionState.SENT)),
                Mono.just(confirmed()));

        long start = System.currentTimeMillis();
        TransactionResult result = poller.await(TX_ID, 10_000, 20);

        assertThat(result.state()).isEqualTo(TransactionState.CONFIRMED);
        assertThat(result.txHash()).isEqualTo("0xhash");
        assertThat(System.currentTimeMillis() - start).isLessThan(2_000);
        verify(sponsorshipApiClient, times(3)).getTransaction(TX_ID);
    }

    @Test
    @DisplayName("Failed → TransactionFailedException immediately")
    void await_fastFailsOnFailed() {
        when(sponsorshipApiClient.getTransaction(TX_ID)).thenReturn(Mono.just(
                new TransactionResult(TX_ID, TransactionState.FAILED, null, null, null, null, "execution reverted")));

        long start = System.currentTimeMillis();
        assertThatThrownBy(() -> poller.await(TX_ID, 10_000, 20))
                .isInstanceOf(TransactionFailedException.class)
                .satisfies(e -> {
                    TransactionFailedException ex = (TransactionFailedException) e;
                    assertThat(ex.getReason()).isEqualTo("execution reverted");
                    assertThat(ex.getState()).isEqualTo(TransactionState.FAILED);
                });
        assertThat(System.currentTimeMillis() - start).isLessThan(2_000);
        verify(sponsorshipApiClient, times(1)).getTransaction(TX_ID);
    }

    @Test
    void await_deniedIsTerminalFailure() {
        when(sponsorshipApiClient.getTransaction(TX_ID)).thenReturn(
                Mono.just(state(TransactionState.PENDING_RISK_SCREENING)),
                Mono.just(state(TransactionState.DENIED)));

        assertThatThrownBy(() -> poller.await(TX_ID, 10_000, 20))
                .isInstanceOf(TransactionFailedException.class)
                .satisfies(e -> assertThat(((TransactionFailedException) e).getState()).isEqualTo(TransactionState.DENIED));
    }

    @Test
    @DisplayName("always Queued with 500/100 → timeout after ~500 ms and at least 4 polls")
    void await_timesOut() {
        when(sponsorshipApiClient.getTransaction(TX_ID)).thenReturn(Mono.just(state(TransactionState.QUEUED)));

        long start = System.currentTimeMillis();
        assertThatThrownBy(() -> poller.await(TX_ID, 500, 100))
                .isInstanceOf(TransactionTimeoutException.class)
                .satisfies(e -> {
                    TransactionTimeoutException ex = (TransactionTimeoutException) e;
                    assertThat(ex.getTransactionId()).isEqualTo(TX_ID);
                    assertThat(ex.getMaxWaitMs()).isEqualTo(500);
                    assertThat(ex.getPolls()).isGreaterThanOrEqualTo(4);
                });
        long elapsed = System.currentTimeMillis() - start;
        assertThat(elapsed).isBetween(400L, 1_500L);
        verify(sponsorshipApiClient, atLeast(4)).getTransaction(TX_ID);
    }

    @Test
    @DisplayName("status query errors are retried, not treated as Failed")
    void await_toleratesTransientErrors() {
        when(sponsorshipApiClient.getTransaction(TX_ID))
                .thenReturn(Mono.error(new SponsorshipApiException(0, "connection reset")))
                .thenReturn(Mono.just(state(TransactionState.SENT)))
                .thenThrow(new SponsorshipApiException(502, "Bad gateway"))
                .thenReturn(Mono.just(confirmed()));

        TransactionResult result = poller.await(TX_ID, 10_000, 20);

        assertThat(result.state()).isEqualTo(TransactionState.CONFIRMED);
        verify(sponsorshipApiClient, times(4)).getTransaction(TX_ID);
    }

    @Test
    void await_unknownStateKeepsWaiting() {
        when(sponsorshipApiClient.getTransaction(TX_ID)).thenReturn(
                Mono.just(state(TransactionState.UNKNOWN)),
                Mono.just(confirmed()));

        assertThat(poller.await(TX_ID).state()).isEqualTo(TransactionState.CONFIRMED);
    }

    @Test
    @DisplayName("interrupting the polling thread stops the loop promptly")
    void await_cancelledByInterrupt() throws InterruptedException {
        when(sponsorshipApiClient.getTransaction(anyString())).thenReturn(Mono.just(state(TransactionState.QUEUED)));
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread poll = new Thread(() -> {
            try {
                poller.await(TX_ID, 60_000, 50);
            } catch (Throwable t) {
                failure.set(t);
            }
        });

        poll.start();
        Thread.sleep(200);
        long interruptedAt = System.currentTimeMillis();
        poll.interrupt();
        poll.join(2_000);

        assertThat(poll.isAlive()).isFalse();
        assertThat(System.currentTimeMillis() - interruptedAt).isLessThan(2_000);
        assertThat(failure.get()).isInstanceOf(TransactionPollCancelledException.class);
    }

    @Test
    void await_rejectsNonPositiveDurations() {
        assertThatThrownBy(() -> poller.await(TX_ID, 0, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> poller.await(TX_ID, 10, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void currentStatus_singleQuery() {
        when(sponsorshipApiClient.getTransaction(TX_ID)).thenReturn(Mono.just(state(TransactionState.QUEUED)));

        assertThat(poller.currentStatus(TX_ID).state()).isEqualTo(TransactionState.QUEUED);
        verify(sponsorshipApiClient, times(1)).getTransaction(TX_ID);
    }

    @Test
    void history_returnsProviderPage() {
        when(sponsorshipApiClient.getTransactionHistory("w-1", Blockchain.BASE_SEPOLIA, 5, 10))
                .thenReturn(Mono.just(List.of(confirmed())));

        assertThat(poller.history("w-1", Blockchain.BASE_SEPOLIA, 5, 10)).containsExactly(confirmed());
    }

    @Test
    void history_providerErrorPropagates() {
        when(sponsorshipApiClient.getTransactionHistory("w-1", Blockchain.BASE_SEPOLIA, 5, 0))
                .thenReturn(Mono.error(new SponsorshipApiException(404, "Wallet not found")));

        assertThatThrownBy(() -> poller.history("w-1", Blockchain.BASE_SEPOLIA, 5, 0))
                .isInstanceOf(SponsorshipApiException.class);
    }

    private static TransactionResult state(TransactionState state) {
        return new TransactionResult(TX_ID, state, null, null, null, null, null);
    }

    private static TransactionResult confirmed() {
        return new TransactionResult(TX_ID, TransactionState.CONFIRMED, "0xhash", "0xblock", 10L, "21000", null);
    }
}
