package com.gaslessmint.provider;

import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.GasEstimate;
import com.gaslessmint.domain.TransactionResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Gas-sponsorship transaction API. Errors surface as {@link SponsorshipApiException} or
 * {@link MalformedProviderResponseException}.
 */
public interface SponsorshipApiClient {

    /**
     * Submits a sponsored contract execution; the result carries the provider transaction id and initial state.
     */
    Mono<TransactionResult> createContractExecution(ContractExecutionRequest request);

    Mono<TransactionResult> getTransaction(String transactionId);

    /**
     * Gas estimate for a contract call. Never errors: when the provider cannot be asked the result carries the
     * configured defaults with {@code estimated == false}.
     */
    Mono<GasEstimate> estimateContractExecution(GasEstimateRequest request);

    /**
     * Transactions of one wallet on one chain, newest first as the provider orders them.
     */
    Mono<List<TransactionResult>> getTransactionHistory(String walletId, Blockchain blockchain, int limit, int offset);
}
