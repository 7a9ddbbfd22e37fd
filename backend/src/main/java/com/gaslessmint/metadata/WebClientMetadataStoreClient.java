package com.gaslessmint.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gaslessmint.domain.NftMetadata;
import com.gaslessmint.metadata.config.MetadataProperties;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Pinata-compatible pinning client using WebClient; key/secret travel as pinata_api_key / pinata_secret_api_key.
 */
public class WebClientMetadataStoreClient implements MetadataStoreClient {

    private final WebClient webClient;
    private final MetadataProperties properties;
    private final ObjectMapper objectMapper;

    public WebClientMetadataStoreClient(WebClient.Builder builder, MetadataProperties properties, ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<String> pinJson(NftMetadata metadata, String name) {
        Map<String, Object> body = Map.of(
                "pinataContent", metadata,
                "pinataMetadata", Map.of(
                        "name", name,
                        "keyvalues", Map.of("project", properties.getProject(), "type", "nft-metadata")
                )
        );
        return webClient.post()
                .uri(properties.getPinningUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .header("pinata_api_key", properties.getPinningApiKey())
                .header("pinata_secret_api_key", properties.getPinningSecretKey())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
                .map(this::ipfsHash);
    }

    @Override
    public Mono<NftMetadata> fetch(String uri) {
        return webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
                .map(this::metadata);
    }

    private String ipfsHash(String body) {
        try {
            JsonNode hash = objectMapper.readTree(body).path("IpfsHash");
            if (!hash.isTextual() || hash.asText().isBlank()) {
                throw new IllegalStateException("Pinning response has no IpfsHash");
            }
            return hash.asText();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Pinning response is not JSON", e);
        }
    }

    private NftMetadata metadata(String body) {
        try {
            return objectMapper.readValue(body, NftMetadata.class);
        } catch (JsonProcessingException e) {
            throw new MetadataFetchException("Metadata document is not valid JSON", e);
        }
    }
}
