package com.example.doisync.sync;

public record IdentifierMessage(String doi, String message) {
}
