package com.example.doisync.registry;

/**
 * Credentials were rejected (HTTP 401). Fatal for a whole batch.
 */
public class RegistryAuthenticationException extends RegistryException {

    public RegistryAuthenticationException(String message) {
        super(message);
    }
}
