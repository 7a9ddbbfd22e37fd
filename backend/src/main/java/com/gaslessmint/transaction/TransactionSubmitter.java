package com.gaslessmint.transaction;

import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.GasEstimate;
import com.gaslessmint.domain.PendingTransaction;
import com.gaslessmint.domain.TransactionResult;
import com.gaslessmint.provider.ContractExecutionRequest;
import com.gaslessmint.provider.GasEstimateRequest;
import com.gaslessmint.provider.MalformedProviderResponseException;
import com.gaslessmint.provider.SponsorshipApiClient;
import com.gaslessmint.provider.config.ProviderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Submits sponsored contract executions. Every call uses a fresh idempotency key: a retry by the caller is a
 * new transaction, never a replay. Provider errors propagate; nothing is resubmitted here.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TransactionSubmitter {

    private final SponsorshipApiClient sponsorshipApiClient;
    private final ProviderProperties providerProperties;

    public PendingTransaction submit(String walletId, String contractAddress, String functionSignature,
                                     List<Object> parameters, Blockchain blockchain) {
        return submit(walletId, contractAddress, functionSignature, parameters, blockchain, "0");
    }

    public PendingTransaction submit(String walletId, String contractAddress, String functionSignature,
                                     List<Object> parameters, Blockchain blockchain, String value) {
        return submit(walletId, contractAddress, functionSignature, parameters, blockchain, value,
                providerProperties.getMintGasLimit());
    }

    /**
     * @param value    native value to send, "0" for none
     * @param gasLimit fixed gas ceiling passed through to the provider
     * @throws com.gaslessmint.provider.SponsorshipApiException on non-2xx or transport failure
     */
    public PendingTransaction submit(String walletId, String contractAddress, String functionSignature,
                                     List<Object> parameters, Blockchain blockchain, String value, String gasLimit) {
        ContractExecutionRequest request = new ContractExecutionRequest(
                UUID.randomUUID().toString(),
                walletId,
                contractAddress,
                functionSignature,
                parameters,
                blockchain,
                value != null ? value : "0",
                providerProperties.getFeeLevel(),
                gasLimit);
        log.info("Submitting {} on {} from wallet {} (idempotencyKey={})",
                functionSignature, blockchain.getProviderCode(), walletId, request.idempotencyKey());
        TransactionResult accepted = sponsorshipApiClient.createContractExecution(request).block();
        if (accepted == null) {
            throw new MalformedProviderResponseException("Empty contract execution response");
        }
        log.info("Transaction {} accepted in state {}", accepted.transactionId(), accepted.state());
        return new PendingTransaction(
                accepted.transactionId(),
                walletId,
                contractAddress,
                functionSignature,
                request.abiParameters(),
                blockchain,
                accepted.state(),
                Instant.now());
    }

    /**
     * Asks the provider what the call would cost. Falls back to configured defaults, see
     * {@link GasEstimate#estimated()}.
     */
    public GasEstimate estimate(String contractAddress, String functionSignature, List<Object> parameters,
                                Blockchain blockchain) {
        GasEstimate estimate = sponsorshipApiClient.estimateContractExecution(
                new GasEstimateRequest(contractAddress, functionSignature, parameters, blockchain)).block();
        if (estimate == null) {
            throw new MalformedProviderResponseException("Empty gas estimate response");
        }
        return estimate;
    }
}
