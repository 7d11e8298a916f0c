package com.example.doisync.registry;

/**
 * Base type for failures talking to the DOI registry.
 */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
