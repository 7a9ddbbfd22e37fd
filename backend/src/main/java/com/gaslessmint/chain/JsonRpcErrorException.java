package com.gaslessmint.chain;

import lombok.Getter;

/**
 * Node answered with a JSON-RPC error object (e.g. execution reverted). Deterministic for the request,
 * so {@link ChainReader} does not fail over to another endpoint.
 */
@Getter
public class JsonRpcErrorException extends RpcException {

    private final int code;

    public JsonRpcErrorException(String method, int code, String message) {
        super(method + " returned error " + code + ": " + message);
        this.code = code;
    }
}
