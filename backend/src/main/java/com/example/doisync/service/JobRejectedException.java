package com.example.doisync.service;

public class JobRejectedException extends RuntimeException {

    public JobRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
