package com.gaslessmint.chain.abi;

import java.util.Map;

/**
 * Log decoded against a known event. Argument values: addresses as lowercase 0x strings, uint256 as BigInteger,
 * uint256[] as List&lt;BigInteger&gt;, strings as String.
 */
public record DecodedEvent(String name, Map<String, Object> args) {

    public DecodedEvent {
        args = Map.copyOf(args);
    }

    public Object arg(String key) {
        return args.get(key);
    }
}
