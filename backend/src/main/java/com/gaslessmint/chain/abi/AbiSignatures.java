package com.gaslessmint.chain.abi;

import com.gaslessmint.common.Hex;
import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.nio.charset.StandardCharsets;

/**
 * Function selectors and event topics from canonical signatures, e.g. {@code "ownerOf(uint256)"}.
 */
public final class AbiSignatures {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private AbiSignatures() {
    }

    public static byte[] keccak256(byte[] input) {
        Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /** 4-byte selector, 0x-prefixed. */
    public static String selector(String signature) {
        return "0x" + Hex.toHex(keccak256(signature.getBytes(StandardCharsets.US_ASCII))).substring(0, 8);
    }

    /** topic0 of an event, 0x-prefixed. */
    public static String topic(String signature) {
        return "0x" + Hex.toHex(keccak256(signature.getBytes(StandardCharsets.US_ASCII)));
    }
}
