package com.example.doisync.local;

/**
 * The local database could not be read, or a failed transaction could not be rolled back.
 */
public class LocalStoreException extends RuntimeException {

    public LocalStoreException(String message) {
        super(message);
    }

    public LocalStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
