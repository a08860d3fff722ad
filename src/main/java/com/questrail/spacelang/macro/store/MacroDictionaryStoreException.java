package com.questrail.spacelang.macro.store;

/**
 * Thrown when a macro dictionary cannot be written or read back.
 */
public class MacroDictionaryStoreException extends RuntimeException {
    public MacroDictionaryStoreException(String message) {
        super(message);
    }

    public MacroDictionaryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
