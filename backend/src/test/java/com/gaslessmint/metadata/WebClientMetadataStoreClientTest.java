package com.gaslessmint.metadata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gaslessmint.domain.NftAttribute;
import com.gaslessmint.domain.NftMetadata;
import com.gaslessmint.metadata.config.MetadataProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientMetadataStoreClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private MetadataProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MetadataProperties();
        properties.setPinningUrl("https://pin.example/pinning/pinJSONToIPFS");
        properties.setPinningApiKey("key");
        properties.setPinningSecretKey("secret");
    }

    @Test
    void pinJson_sendsCredentialsAndReadsHash() {
        MetadataStoreClient client = client(HttpStatus.OK, "{\"IpfsHash\":\"QmHash\",\"PinSize\":120}");

        String hash = client.pinJson(new NftMetadata("N1", null, null, List.of(), null), "N1_metadata.json").block();

        assertThat(hash).isEqualTo("QmHash");
        ClientRequest request = lastRequest.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url()).isEqualTo(URI.create("https://pin.example/pinning/pinJSONToIPFS"));
        assertThat(request.headers().getFirst("pinata_api_key")).isEqualTo("key");
        assertThat(request.headers().getFirst("pinata_secret_api_key")).isEqualTo("secret");
    }

    @Test
    void pinJson_missingHashIsAnError() {
        MetadataStoreClient client = client(HttpStatus.OK, "{\"PinSize\":120}");

        assertThatThrownBy(() -> client.pinJson(new NftMetadata("N1", null, null, List.of(), null), "n").block())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void pinJson_httpErrorPropagates() {
        MetadataStoreClient client = client(HttpStatus.UNAUTHORIZED, "{\"error\":\"invalid key\"}");

        assertThatThrownBy(() -> client.pinJson(new NftMetadata("N1", null, null, List.of(), null), "n").block())
                .isInstanceOf(WebClientResponseException.class);
    }

    @Test
    void fetch_parsesMarketplaceLayout() {
        MetadataStoreClient client = client(HttpStatus.OK, """
                {"name":"N1","description":"d","image":"ipfs://img","external_url":"https://x",
                 "attributes":[{"trait_type":"level","value":3}],"extra":"ignored"}
                """);

        NftMetadata metadata = client.fetch("https://gateway.test/ipfs/QmHash").block();

        assertThat(metadata.name()).isEqualTo("N1");
        assertThat(metadata.imageUri()).isEqualTo("ipfs://img");
        assertThat(metadata.externalUri()).isEqualTo("https://x");
        assertThat(metadata.attributes()).containsExactly(new NftAttribute("level", 3));
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.GET);
    }

    @Test
    void fetch_nonJsonDocumentFails() {
        MetadataStoreClient client = client(HttpStatus.OK, "<html>not json</html>");

        assertThatThrownBy(() -> client.fetch("https://gateway.test/ipfs/QmHash").block())
                .isInstanceOf(MetadataFetchException.class);
    }

    private MetadataStoreClient client(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            lastRequest.set(req);
            return Mono.just(ClientResponse.create(status)
                    .header("Content-Type", "application/json")
                    .body(body)
                    .build());
        });
        return new WebClientMetadataStoreClient(builder, properties, new ObjectMapper());
    }
}
