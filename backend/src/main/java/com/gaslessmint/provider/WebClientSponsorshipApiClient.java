package com.gaslessmint.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.GasEstimate;
import com.gaslessmint.domain.TransactionResult;
import com.gaslessmint.provider.config.ProviderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sponsorship API client using WebClient. Non-2xx responses map to {@link SponsorshipApiException} with the
 * provider's status and message; transport failures use status 0.
 */
@Slf4j
public class WebClientSponsorshipApiClient implements SponsorshipApiClient {

    private final WebClient webClient;
    private final ProviderProperties properties;
    private final ProviderResponses responses;

    public WebClientSponsorshipApiClient(WebClient.Builder builder, ProviderProperties properties, ObjectMapper objectMapper) {
        this.webClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
        this.properties = properties;
        this.responses = new ProviderResponses(objectMapper);
    }

    @Override
    public Mono<TransactionResult> createContractExecution(ContractExecutionRequest request) {
        return webClient.post()
                .uri("/v1/w3s/developer/transactions/contractExecution")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody(request))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toSponsorshipException)
                .bodyToMono(String.class)
                .timeout(timeout())
                .map(responses::transaction)
                .onErrorMap(WebClientSponsorshipApiClient::isTransportError,
                        e -> new SponsorshipApiException(0, String.valueOf(e.getMessage()), e));
    }

    @Override
    public Mono<TransactionResult> getTransaction(String transactionId) {
        return webClient.get()
                .uri("/v1/w3s/transactions/{id}", transactionId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toSponsorshipException)
                .bodyToMono(String.class)
                .timeout(timeout())
                .map(responses::transaction)
                .onErrorMap(WebClientSponsorshipApiClient::isTransportError,
                        e -> new SponsorshipApiException(0, String.valueOf(e.getMessage()), e));
    }

    @Override
    public Mono<GasEstimate> estimateContractExecution(GasEstimateRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("blockchain", request.blockchain().getProviderCode());
        body.put("contractAddress", request.contractAddress());
        body.put("abiFunctionSignature", request.abiFunctionSignature());
        body.put("abiParameters", request.abiParameters());
        return webClient.post()
                .uri("/v1/w3s/transactions/estimate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toSponsorshipException)
                .bodyToMono(String.class)
                .timeout(timeout())
                .map(json -> responses.gasEstimate(json, request.blockchain()))
                .onErrorResume(e -> {
                    log.warn("Gas estimate for {} on {} failed, using defaults: {}",
                            request.abiFunctionSignature(), request.blockchain().getProviderCode(), e.getMessage());
                    return Mono.just(GasEstimate.fallback(request.blockchain(), properties.getMintGasLimit(),
                            properties.getFallbackGasPrice(), properties.getFallbackEstimatedCost(),
                            String.valueOf(e.getMessage())));
                });
    }

    @Override
    public Mono<List<TransactionResult>> getTransactionHistory(String walletId, Blockchain blockchain, int limit,
                                                               int offset) {
        if (limit <= 0 || offset < 0) {
            return Mono.error(new IllegalArgumentException("limit must be positive and offset non-negative"));
        }
        return webClient.get()
                .uri(uri -> uri.path("/v1/w3s/transactions")
                        .queryParam("walletIds", walletId)
                        .queryParam("blockchain", blockchain.getProviderCode())
                        .queryParam("limit", limit)
                        .queryParam("offset", offset)
                        .build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toSponsorshipException)
                .bodyToMono(String.class)
                .timeout(timeout())
                .map(responses::transactions)
                .onErrorMap(WebClientSponsorshipApiClient::isTransportError,
                        e -> new SponsorshipApiException(0, String.valueOf(e.getMessage()), e));
    }

    /** Amount is sent only for payable calls; gasLimit only when set. */
    Map<String, Object> requestBody(ContractExecutionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("idempotencyKey", request.idempotencyKey());
        body.put("walletId", request.walletId());
        body.put("contractAddress", request.contractAddress());
        body.put("abiFunctionSignature", request.abiFunctionSignature());
        body.put("abiParameters", request.abiParameters());
        body.put("blockchain", request.blockchain().getProviderCode());
        body.put("feeLevel", request.feeLevel());
        if (request.gasLimit() != null) {
            body.put("gasLimit", request.gasLimit());
        }
        if (request.amount() != null && !"0".equals(request.amount())) {
            body.put("amount", request.amount());
        }
        if (properties.hasEntitySecretCiphertext()) {
            body.put("entitySecretCiphertext", properties.getEntitySecretCiphertext());
        }
        return body;
    }

    private Mono<? extends Throwable> toSponsorshipException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new SponsorshipApiException(status, responses.errorMessage(body)));
    }

    private Duration timeout() {
        return Duration.ofMillis(properties.getRequestTimeoutMs());
    }

    private static boolean isTransportError(Throwable e) {
        return !(e instanceof SponsorshipApiException) && !(e instanceof MalformedProviderResponseException);
    }
}
