package com.gaslessmint.chain;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientEvmRpcClientTest {

    private static final String ENDPOINT = "https://rpc.example";

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void call_returnsRawBody() {
        EvmRpcClient client = client(HttpStatus.OK, "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x10\"}");

        StepVerifier.create(client.call(ENDPOINT, "eth_blockNumber", List.of()))
                .assertNext(body -> assertThat(body).contains("\"result\":\"0x10\""))
                .verifyComplete();
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(lastRequest.get().url()).isEqualTo(URI.create(ENDPOINT));
    }

    @Test
    void call_httpErrorBecomesRpcException() {
        EvmRpcClient client = client(HttpStatus.SERVICE_UNAVAILABLE, "busy");

        StepVerifier.create(client.call(ENDPOINT, "eth_getTransactionReceipt", List.of("0xtx")))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(RpcException.class)
                        .hasMessageContaining("eth_getTransactionReceipt"))
                .verify();
    }

    @Test
    void call_timeoutBecomesRpcException() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> Mono.never());
        EvmRpcClient client = new WebClientEvmRpcClient(builder, Duration.ofMillis(50));

        StepVerifier.create(client.call(ENDPOINT, "eth_call", List.of()))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(RpcException.class)
                        .hasMessageContaining("timed out"))
                .verify(Duration.ofSeconds(5));
    }

    private EvmRpcClient client(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            lastRequest.set(req);
            return Mono.just(ClientResponse.create(status)
                    .header("Content-Type", "application/json")
                    .body(body)
                    .build());
        });
        return new WebClientEvmRpcClient(builder, Duration.ofSeconds(5));
    }
}
