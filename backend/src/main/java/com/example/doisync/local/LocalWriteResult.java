package com.example.doisync.local;

import java.util.List;

/**
 * Result of one facet replacement transaction. A failure means the transaction was rolled back.
 */
public record LocalWriteResult(boolean success, String message, List<String> warnings) {

    public LocalWriteResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static LocalWriteResult success(String message, List<String> warnings) {
        return new LocalWriteResult(true, message, warnings);
    }

    public static LocalWriteResult failure(String message) {
        return new LocalWriteResult(false, message, List.of());
    }
}
