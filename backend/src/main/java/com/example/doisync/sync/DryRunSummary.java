package com.example.doisync.sync;

import java.util.List;

public record DryRunSummary(int validCount, int invalidCount, List<DryRunResult> results) {

    public DryRunSummary {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public long changedCount() {
        return results.stream().filter(r -> r.valid() && r.hasChanges()).count();
    }
}
