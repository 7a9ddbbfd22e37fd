package com.gaslessmint.chain;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC client abstraction; endpoint choice and rate limiting belong to {@link ChainReader}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getTransactionReceipt"
     * @param params      positional params
     * @return raw JSON response body; errors as {@link RpcException}
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
