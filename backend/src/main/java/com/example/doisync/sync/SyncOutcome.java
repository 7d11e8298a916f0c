package com.example.doisync.sync;

import com.example.doisync.model.Facet;

public record SyncOutcome(
        String doi,
        Facet facet,
        SyncStatus status,
        String message,
        boolean retried,
        boolean remoteOnly,
        boolean schemaUpgraded
) {
    public static SyncOutcome of(String doi, Facet facet, SyncStatus status, String message) {
        return new SyncOutcome(doi, facet, status, message, false, false, false);
    }
}
