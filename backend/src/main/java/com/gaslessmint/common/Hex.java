package com.gaslessmint.common;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Hex helpers for 32-byte ABI words and 0x-prefixed quantities.
 */
public final class Hex {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final int WORD_HEX = 64;

    private Hex() {
    }

    public static String strip0x(String hex) {
        if (hex == null) {
            return "";
        }
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    public static boolean isZeroAddress(String address) {
        if (address == null || address.isBlank()) {
            return true;
        }
        String h = strip0x(address.trim());
        for (int i = 0; i < h.length(); i++) {
            if (h.charAt(i) != '0') {
                return false;
            }
        }
        return true;
    }

    /** 0x followed by exactly 40 hex digits, any case. */
    public static boolean isAddress(String value) {
        if (value == null || value.length() != 42 || !(value.startsWith("0x") || value.startsWith("0X"))) {
            return false;
        }
        for (int i = 2; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /** Parses a 0x quantity; "0x" and empty are zero. */
    public static BigInteger toBigInteger(String hex) {
        String h = strip0x(hex);
        if (h.isEmpty()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(h, 16);
    }

    /** Address from an indexed topic or a 32-byte word: last 20 bytes, lowercase. */
    public static String wordToAddress(String word) {
        String h = strip0x(word);
        if (h.length() < 40) {
            throw new IllegalArgumentException("Word too short for address: " + word);
        }
        return "0x" + h.substring(h.length() - 40).toLowerCase(Locale.ROOT);
    }

    /** Left-pads an address or quantity to one 32-byte ABI word (no 0x). */
    public static String padWord(String hex) {
        String h = strip0x(hex).toLowerCase(Locale.ROOT);
        if (h.length() > WORD_HEX) {
            throw new IllegalArgumentException("Value exceeds 32 bytes: " + hex);
        }
        return "0".repeat(WORD_HEX - h.length()) + h;
    }

    public static String padWord(BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Negative value: " + value);
        }
        return padWord(value.toString(16));
    }

    /** i-th 32-byte word of ABI data (no 0x). */
    public static String word(String data, int index) {
        String h = strip0x(data);
        int start = index * WORD_HEX;
        if (start + WORD_HEX > h.length()) {
            throw new IllegalArgumentException("ABI data has no word at index " + index);
        }
        return h.substring(start, start + WORD_HEX);
    }

    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    public static byte[] fromHex(String hex) {
        String h = strip0x(hex);
        if (h.length() % 2 != 0) {
            throw new IllegalArgumentException("Odd-length hex: " + hex);
        }
        byte[] out = new byte[h.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(h.charAt(2 * i), 16);
            int lo = Character.digit(h.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Invalid hex: " + hex);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }
}
