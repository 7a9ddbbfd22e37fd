package com.gaslessmint.chain.abi;

import com.gaslessmint.common.Hex;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads head/tail encoded ABI data (log data, eth_call results). Malformed input raises
 * IllegalArgumentException, IndexOutOfBoundsException or ArithmeticException.
 */
public final class AbiDecoder {

    private AbiDecoder() {
    }

    public static BigInteger readUint(String data, int wordIndex) {
        return new BigInteger(Hex.word(data, wordIndex), 16);
    }

    public static String readAddress(String data, int wordIndex) {
        return Hex.wordToAddress(Hex.word(data, wordIndex));
    }

    /** Dynamic {@code string} whose offset sits in head word {@code headIndex}. */
    public static String readString(String data, int headIndex) {
        int offsetWords = offsetInWords(data, headIndex);
        int length = readUint(data, offsetWords).intValueExact();
        String hex = Hex.strip0x(data);
        long start = (offsetWords + 1L) * 64;
        long end = start + length * 2L;
        if (end > hex.length()) {
            throw new IllegalArgumentException("string runs past end of data");
        }
        return new String(Hex.fromHex(hex.substring((int) start, (int) end)), StandardCharsets.UTF_8);
    }

    /** Dynamic {@code uint256[]} whose offset sits in head word {@code headIndex}. */
    public static List<BigInteger> readUintArray(String data, int headIndex) {
        int offsetWords = offsetInWords(data, headIndex);
        int length = readUint(data, offsetWords).intValueExact();
        // length comes from untrusted data: it must fit in the words that follow
        long available = Hex.strip0x(data).length() / 64L - (offsetWords + 1L);
        if (length < 0 || length > available) {
            throw new IllegalArgumentException("array length " + length + " exceeds the " + available + " words of data");
        }
        List<BigInteger> values = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            values.add(readUint(data, offsetWords + 1 + i));
        }
        return values;
    }

    private static int offsetInWords(String data, int headIndex) {
        int offsetBytes = readUint(data, headIndex).intValueExact();
        if (offsetBytes % 32 != 0) {
            throw new IllegalArgumentException("unaligned offset " + offsetBytes);
        }
        return offsetBytes / 32;
    }
}
