package com.gaslessmint.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gaslessmint.domain.Blockchain;
import com.gaslessmint.domain.TokenBalance;
import com.gaslessmint.domain.Wallet;
import com.gaslessmint.domain.WalletAccountType;
import com.gaslessmint.provider.config.ProviderProperties;
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
import java.util.UUID;

/**
 * Wallet provider client using WebClient. Bearer API key auth against the provider base URL.
 */
public class WebClientWalletApiClient implements WalletApiClient {

    private final WebClient webClient;
    private final ProviderProperties properties;
    private final ProviderResponses responses;

    public WebClientWalletApiClient(WebClient.Builder builder, ProviderProperties properties, ObjectMapper objectMapper) {
        this.webClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .build();
        this.properties = properties;
        this.responses = new ProviderResponses(objectMapper);
    }

    @Override
    public Mono<List<Wallet>> createWallets(int count, WalletAccountType accountType, List<Blockchain> blockchains,
                                            String walletSetId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("idempotencyKey", UUID.randomUUID().toString());
        body.put("count", count);
        body.put("accountType", accountType.name());
        body.put("blockchains", blockchains.stream().map(Blockchain::getProviderCode).toList());
        body.put("walletSetId", walletSetId);
        if (properties.hasEntitySecretCiphertext()) {
            body.put("entitySecretCiphertext", properties.getEntitySecretCiphertext());
        }
        return webClient.post()
                .uri("/v1/w3s/developer/wallets")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toProviderException)
                .bodyToMono(String.class)
                .timeout(timeout())
                .map(responses::wallets)
                .onErrorMap(WebClientWalletApiClient::isTransportError,
                        e -> new WalletProviderException(0, "Wallet creation failed: " + e.getMessage(), e));
    }

    @Override
    public Mono<Wallet> getWallet(String walletId) {
        return webClient.get()
                .uri("/v1/w3s/wallets/{id}", walletId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toProviderException)
                .bodyToMono(String.class)
                .timeout(timeout())
                .map(responses::singleWallet)
                .onErrorMap(WebClientWalletApiClient::isTransportError,
                        e -> new WalletProviderException(0, "Wallet lookup failed: " + e.getMessage(), e));
    }

    @Override
    public Mono<List<TokenBalance>> getBalances(String walletId) {
        return webClient.get()
                .uri("/v1/w3s/wallets/{id}/balances", walletId)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toProviderException)
                .bodyToMono(String.class)
                .timeout(timeout())
                .map(responses::balances)
                .onErrorMap(WebClientWalletApiClient::isTransportError,
                        e -> new WalletProviderException(0, "Balance lookup failed: " + e.getMessage(), e));
    }

    private Mono<? extends Throwable> toProviderException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new WalletProviderException(status,
                        "Wallet provider returned " + status + ": " + responses.errorMessage(body), null));
    }

    private Duration timeout() {
        return Duration.ofMillis(properties.getRequestTimeoutMs());
    }

    private static boolean isTransportError(Throwable e) {
        return !(e instanceof WalletProviderException) && !(e instanceof MalformedProviderResponseException);
    }
}
