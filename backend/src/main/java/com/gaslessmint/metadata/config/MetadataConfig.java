package com.gaslessmint.metadata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gaslessmint.metadata.MetadataStoreClient;
import com.gaslessmint.metadata.WebClientMetadataStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(MetadataProperties.class)
public class MetadataConfig {

    @Bean
    public MetadataStoreClient metadataStoreClient(WebClient.Builder webClientBuilder, MetadataProperties properties,
                                                   ObjectMapper objectMapper) {
        return new WebClientMetadataStoreClient(webClientBuilder.clone(), properties, objectMapper);
    }
}
