package com.gaslessmint.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gaslessmint.domain.Blockchain;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only chain access: receipts and eth_call. Every call takes a permit from the shared chain RPC limiter;
 * transport failures fail over to the chain's next endpoint, JSON-RPC errors do not.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChainReader {

    private final EvmRpcClient rpcClient;
    @Qualifier("chainRotators")
    private final Map<Blockchain, RpcEndpointRotator> rotatorsByChain;
    @Qualifier("chainRpcRateLimiter")
    private final RateLimiter chainRpcRateLimiter;
    private final ObjectMapper objectMapper;

    /**
     * @return the receipt, or empty while the node does not know the transaction yet
     */
    public Optional<TransactionReceipt> getTransactionReceipt(Blockchain chain, String txHash) {
        JsonNode result = call(chain, "eth_getTransactionReceipt", List.of(txHash));
        if (result.isNull() || result.isMissingNode()) {
            return Optional.empty();
        }
        List<ReceiptLog> logs = new ArrayList<>();
        for (JsonNode entry : result.path("logs")) {
            List<String> topics = new ArrayList<>();
            entry.path("topics").forEach(t -> topics.add(t.asText()));
            logs.add(new ReceiptLog(entry.path("address").asText(null), topics, entry.path("data").asText("0x")));
        }
        return Optional.of(new TransactionReceipt(
                result.path("transactionHash").asText(txHash),
                result.path("blockHash").asText(null),
                result.path("blockNumber").asText(null),
                result.path("status").asText(null),
                logs));
    }

    /**
     * eth_call against the latest block.
     *
     * @return 0x-prefixed return data
     */
    public String ethCall(Blockchain chain, String to, String data) {
        JsonNode result = call(chain, "eth_call", List.of(Map.of("to", to, "data", data), "latest"));
        if (!result.isTextual()) {
            throw new RpcException("eth_call to " + to + " returned no result");
        }
        return result.asText();
    }

    private JsonNode call(Blockchain chain, String method, Object params) {
        RpcEndpointRotator rotator = rotatorsByChain.get(chain);
        if (rotator == null) {
            throw new UnsupportedChainException(chain, "No RPC endpoint configured for " + chain);
        }
        RpcException last = null;
        int attempts = rotator.getEndpoints().size();
        for (int attempt = 0; attempt < attempts; attempt++) {
            String endpoint = rotator.getNextEndpoint();
            try {
                return result(method, callRpc(endpoint, method, params));
            } catch (JsonRpcErrorException e) {
                throw e;
            } catch (RpcException e) {
                log.warn("{} on {} failed (attempt {}/{}): {}", method, endpoint, attempt + 1, attempts, e.getMessage());
                last = e;
            }
        }
        throw last;
    }

    private String callRpc(String endpoint, String method, Object params) {
        boolean permitted = chainRpcRateLimiter.acquirePermission();
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        String json = rpcClient.call(endpoint, method, params).block();
        if (json == null) {
            throw new RpcException("Empty response for " + method + " from " + endpoint);
        }
        return json;
    }

    private JsonNode result(String method, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Invalid JSON from " + method, e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new JsonRpcErrorException(method, error.path("code").asInt(), error.path("message").asText(""));
        }
        return root.path("result");
    }
}
