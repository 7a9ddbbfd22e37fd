package com.gaslessmint.chain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gaslessmint.domain.Blockchain;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChainReaderTest {

    private static final String RPC_A = "https://rpc-a.example";
    private static final String RPC_B = "https://rpc-b.example";

    @Mock
    EvmRpcClient rpcClient;

    private ChainReader chainReader;

    @BeforeEach
    void setUp() {
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(100)
                .timeoutDuration(Duration.ZERO)
                .build());
        chainReader = new ChainReader(rpcClient,
                Map.of(Blockchain.ETH_SEPOLIA, new RpcEndpointRotator(List.of(RPC_A, RPC_B))),
                limiter, new ObjectMapper());
    }

    @Test
    void getTransactionReceipt_parsesLogs() {
        String json = """
                {"jsonrpc":"2.0","id":1,"result":{
                  "transactionHash":"0xtx","blockHash":"0xbh","blockNumber":"0x10","status":"0x1",
                  "logs":[{"address":"0xabc","topics":["0xt0","0xt1"],"data":"0x01"}]}}
                """;
        when(rpcClient.call(eq(RPC_A), eq("eth_getTransactionReceipt"), any())).thenReturn(Mono.just(json));

        Optional<TransactionReceipt> receipt = chainReader.getTransactionReceipt(Blockchain.ETH_SEPOLIA, "0xtx");

        assertThat(receipt).isPresent();
        assertThat(receipt.get().status()).isEqualTo("0x1");
        assertThat(receipt.get().logs()).containsExactly(new ReceiptLog("0xabc", List.of("0xt0", "0xt1"), "0x01"));
    }

    @Test
    void getTransactionReceipt_nullResult_empty() {
        when(rpcClient.call(eq(RPC_A), eq("eth_getTransactionReceipt"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}"));

        assertThat(chainReader.getTransactionReceipt(Blockchain.ETH_SEPOLIA, "0xtx")).isEmpty();
    }

    @Test
    @DisplayName("transport failure on one endpoint fails over to the next")
    void call_failsOverOnTransportError() {
        when(rpcClient.call(eq(RPC_A), eq("eth_call"), any())).thenReturn(Mono.error(new RpcException("503")));
        when(rpcClient.call(eq(RPC_B), eq("eth_call"), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x2a\"}"));

        assertThat(chainReader.ethCall(Blockchain.ETH_SEPOLIA, "0xabc", "0x18160ddd")).isEqualTo("0x2a");
    }

    @Test
    @DisplayName("JSON-RPC error (revert) is not retried on another endpoint")
    void call_jsonRpcError_noFailover() {
        when(rpcClient.call(eq(RPC_A), eq("eth_call"), any())).thenReturn(Mono.just(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":3,\"message\":\"execution reverted\"}}"));

        assertThatThrownBy(() -> chainReader.ethCall(Blockchain.ETH_SEPOLIA, "0xabc", "0x6352211e"))
                .isInstanceOf(JsonRpcErrorException.class)
                .hasMessageContaining("execution reverted");
        verify(rpcClient, never()).call(eq(RPC_B), any(), any());
    }

    @Test
    void call_allEndpointsFail_throwsLast() {
        when(rpcClient.call(any(), eq("eth_call"), any())).thenReturn(Mono.error(new RpcException("down")));

        assertThatThrownBy(() -> chainReader.ethCall(Blockchain.ETH_SEPOLIA, "0xabc", "0x"))
                .isInstanceOf(RpcException.class)
                .hasMessage("down");
    }

    @Test
    void call_unconfiguredChain_throws() {
        assertThatThrownBy(() -> chainReader.getTransactionReceipt(Blockchain.BASE, "0xtx"))
                .isInstanceOf(UnsupportedChainException.class);
    }
}
