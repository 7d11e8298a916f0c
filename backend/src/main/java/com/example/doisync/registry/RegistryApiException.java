package com.example.doisync.registry;

public class RegistryApiException extends RegistryException {
    private final int status;

    public RegistryApiException(String message, int status) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
