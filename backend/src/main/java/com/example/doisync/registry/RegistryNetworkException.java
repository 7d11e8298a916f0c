package com.example.doisync.registry;

/**
 * The registry could not be reached at all. Fatal for a whole batch.
 */
public class RegistryNetworkException extends RegistryException {

    public RegistryNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
