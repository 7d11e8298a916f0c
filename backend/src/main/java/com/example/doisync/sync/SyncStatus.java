package com.example.doisync.sync;

public enum SyncStatus {
    UPDATED,
    SKIPPED_UNCHANGED,
    FAILED_NOT_FOUND,
    FAILED_LOCAL,
    FAILED_REMOTE,
    /** Local store committed, registry write failed twice. Needs manual remediation. */
    INCONSISTENT;

    public boolean isFailure() {
        return this == FAILED_NOT_FOUND || this == FAILED_LOCAL || this == FAILED_REMOTE || this == INCONSISTENT;
    }
}
