package com.gaslessmint.provider.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gaslessmint.provider.SponsorshipApiClient;
import com.gaslessmint.provider.WalletApiClient;
import com.gaslessmint.provider.WebClientSponsorshipApiClient;
import com.gaslessmint.provider.WebClientWalletApiClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(ProviderProperties.class)
public class ProviderClientConfig {

    @Bean
    public WalletApiClient walletApiClient(WebClient.Builder webClientBuilder, ProviderProperties properties,
                                           ObjectMapper objectMapper) {
        return new WebClientWalletApiClient(webClientBuilder.clone(), properties, objectMapper);
    }

    @Bean
    public SponsorshipApiClient sponsorshipApiClient(WebClient.Builder webClientBuilder, ProviderProperties properties,
                                                     ObjectMapper objectMapper) {
        return new WebClientSponsorshipApiClient(webClientBuilder.clone(), properties, objectMapper);
    }
}
