package com.gaslessmint.chain;

/**
 * Receipt or log could not be decoded. Never reaches mint callers: the receipt parser turns it into the
 * "pending" / empty-list sentinels.
 */
public class ReceiptParseException extends RuntimeException {

    public ReceiptParseException(String message) {
        super(message);
    }

    public ReceiptParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
