package com.gaslessmint.chain;

/**
 * Thrown when an RPC call fails (HTTP, transport or JSON-RPC error).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
