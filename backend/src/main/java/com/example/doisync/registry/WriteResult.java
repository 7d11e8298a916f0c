package com.example.doisync.registry;

/**
 * Outcome of one registry write. A failed write is a value, not an exception;
 * only authentication and connectivity problems are thrown.
 */
public record WriteResult(boolean success, String message, boolean schemaUpgraded, int httpStatus) {

    public static WriteResult ok(String message) {
        return new WriteResult(true, message, false, 200);
    }

    public static WriteResult okAfterUpgrade(String message) {
        return new WriteResult(true, message, true, 200);
    }

    public static WriteResult failure(String message, int httpStatus) {
        return new WriteResult(false, message, false, httpStatus);
    }
}
