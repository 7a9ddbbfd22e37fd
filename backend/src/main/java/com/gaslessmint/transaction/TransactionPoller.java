package com.gaslessmint.transaction;

import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.TransactionResult;
import com.gaslessmint.domain.TransactionState;
import com.gaslessmint.provider.MalformedProviderResponseException;
import com.gaslessmint.provider.SponsorshipApiClient;
import com.gaslessmint.transaction.config.PollingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Waits for a sponsored transaction to reach a terminal state by fixed-interval polling.
 * <p>
 * CONFIRMED returns; FAILED, DENIED and CANCELLED throw {@link TransactionFailedException} on first sight;
 * every other state (including unknown ones) and every query error means "poll again". Query errors share the
 * single {@code maxWaitMs} budget, there is no separate retry counter. Interrupting the polling thread stops
 * the loop with {@link TransactionPollCancelledException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TransactionPoller {

    private final SponsorshipApiClient sponsorshipApiClient;
    private final PollingProperties pollingProperties;

    public TransactionResult await(String transactionId) {
        return await(transactionId, pollingProperties.getMaxWaitMs(), pollingProperties.getPollIntervalMs());
    }

    public TransactionResult await(String transactionId, long maxWaitMs, long pollIntervalMs) {
        if (maxWaitMs <= 0 || pollIntervalMs <= 0) {
            throw new IllegalArgumentException("maxWaitMs and pollIntervalMs must be positive");
        }
        long start = System.nanoTime();
        long budgetNanos = TimeUnit.MILLISECONDS.toNanos(maxWaitMs);
        int polls = 0;
        TransactionState lastState = null;
        while (System.nanoTime() - start < budgetNanos) {
            if (Thread.currentThread().isInterrupted()) {
                throw new TransactionPollCancelledException(transactionId, null);
            }
            polls++;
            try {
                TransactionResult result = query(transactionId);
                if (result.state() != lastState) {
                    log.info("Transaction {} is {} (poll {})", transactionId, result.state(), polls);
                    lastState = result.state();
                }
                if (result.state() == TransactionState.CONFIRMED) {
                    return result;
                }
                if (result.state().isFailure()) {
                    throw new TransactionFailedException(transactionId, result.state(), result.errorReason());
                }
            } catch (TransactionFailedException | TransactionPollCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                if (isInterruption(e)) {
                    Thread.currentThread().interrupt();
                    throw new TransactionPollCancelledException(transactionId, e);
                }
                log.warn("Status query {} for transaction {} failed, will retry: {}", polls, transactionId, e.getMessage());
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(budgetNanos - (System.nanoTime() - start));
            if (remainingMs <= 0) {
                break;
            }
            sleep(transactionId, Math.min(pollIntervalMs, remainingMs));
        }
        throw new TransactionTimeoutException(transactionId, maxWaitMs, polls);
    }

    /**
     * Single status query, no waiting.
     */
    public TransactionResult currentStatus(String transactionId) {
        return query(transactionId);
    }

    /**
     * One page of a wallet's transactions.
     *
     * @throws IllegalArgumentException if limit is not positive or offset is negative
     */
    public List<TransactionResult> history(String walletId, Blockchain blockchain, int limit, int offset) {
        List<TransactionResult> page = sponsorshipApiClient.getTransactionHistory(walletId, blockchain, limit, offset)
                .block();
        return page != null ? page : List.of();
    }

    private TransactionResult query(String transactionId) {
        TransactionResult result = sponsorshipApiClient.getTransaction(transactionId).block();
        if (result == null) {
            throw new MalformedProviderResponseException("Empty status response for " + transactionId);
        }
        return result;
    }

    private static void sleep(String transactionId, long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransactionPollCancelledException(transactionId, e);
        }
    }

    private static boolean isInterruption(Throwable e) {
        return Thread.currentThread().isInterrupted() || Exceptions.unwrap(e) instanceof InterruptedException;
    }
}
