package com.example.doisync.sync;

/**
 * Events emitted by {@link SyncOrchestrator}, in order, on the executing thread.
 */
public interface SyncEvent {

    String type();

    record Validation(String message) implements SyncEvent {
        public String type() { return "validation"; }
    }

    record Progress(int current, int total, String message) implements SyncEvent {
        public String type() { return "progress"; }
    }

    record DryRunCompleted(DryRunSummary summary) implements SyncEvent {
        public String type() { return "dry_run_complete"; }
    }

    record LocalUpdate(String doi, String message) implements SyncEvent {
        public String type() { return "local_update"; }
    }

    record RemoteUpdate(String doi, String message) implements SyncEvent {
        public String type() { return "remote_update"; }
    }

    record Outcome(SyncOutcome outcome) implements SyncEvent {
        public String type() { return "outcome"; }
    }

    record BatchFinished(BatchSummary summary) implements SyncEvent {
        public String type() { return "batch_finished"; }
    }

    record BatchAborted(FatalKind kind, String message) implements SyncEvent {
        public String type() { return "batch_aborted"; }
    }
}
