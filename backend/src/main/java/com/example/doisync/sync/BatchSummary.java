package com.example.doisync.sync;

import com.example.doisync.model.Facet;

import java.util.List;

/**
 * Final result of one batch. Counts only cover identifiers that were actually processed;
 * an aborted or cancelled batch reports what it reached.
 */
public record BatchSummary(
        Facet facet,
        int total,
        int updated,
        int failed,
        int skipped,
        List<IdentifierMessage> failures,
        List<IdentifierMessage> skips,
        List<SyncOutcome> outcomes,
        boolean aborted,
        FatalKind fatalKind,
        String fatalMessage,
        boolean cancelled,
        boolean dryRunOnly
) {
    public BatchSummary {
        failures = failures == null ? List.of() : List.copyOf(failures);
        skips = skips == null ? List.of() : List.copyOf(skips);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public long inconsistentCount() {
        return outcomes.stream().filter(o -> o.status() == SyncStatus.INCONSISTENT).count();
    }
}
