package com.example.doisync.source;

public class InvalidDesiredStateException extends RuntimeException {

    public InvalidDesiredStateException(String message) {
        super(message);
    }
}
