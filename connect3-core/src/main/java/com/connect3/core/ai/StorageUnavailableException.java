package com.connect3.core.ai;

/**
 * Raised when the transposition table's backing file cannot be read or written.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
