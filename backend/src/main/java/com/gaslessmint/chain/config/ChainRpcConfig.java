package com.gaslessmint.chain.config;

import com.gaslessmint.chain.EvmRpcClient;
import com.gaslessmint.chain.RpcEndpointRotator;
import com.gaslessmint.chain.WebClientEvmRpcClient;
import com.gaslessmint.domain.Blockchain;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Chain RPC plumbing: one rotator per configured chain, the JSON-RPC client and the shared rate limiter.
 */
@Configuration
@Slf4j
@EnableConfigurationProperties(ChainProperties.class)
public class ChainRpcConfig {

    @Bean
    public Map<Blockchain, RpcEndpointRotator> chainRotators(ChainProperties properties) {
        Map<Blockchain, RpcEndpointRotator> rotators = new EnumMap<>(Blockchain.class);
        properties.getNetworks().forEach((key, entry) -> {
            if (entry == null || entry.getRpcUrls().isEmpty()) {
                return;
            }
            Blockchain.fromProviderCode(key).ifPresentOrElse(
                    chain -> rotators.put(chain, new RpcEndpointRotator(entry.getRpcUrls())),
                    () -> log.warn("Ignoring RPC urls for unknown chain {}", key));
        });
        return rotators;
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, ChainProperties properties) {
        return new WebClientEvmRpcClient(webClientBuilder.clone(), Duration.ofMillis(properties.getRpcTimeoutMs()));
    }

    @Bean(name = "chainRpcRateLimiter")
    public RateLimiter chainRpcRateLimiter(ChainProperties properties) {
        int rps = Math.max(1, properties.getRpcMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getRpcLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }
}
