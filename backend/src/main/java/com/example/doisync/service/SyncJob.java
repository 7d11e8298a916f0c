package com.example.doisync.service;

import com.example.doisync.model.Facet;
import com.example.doisync.sync.BatchSummary;
import com.example.doisync.sync.DryRunSummary;
import com.example.doisync.sync.SyncEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live view of one submitted batch. Written by the executor thread, read by request threads.
 */
public class SyncJob {

    public enum State { QUEUED, RUNNING, COMPLETED, ABORTED, CANCELLED, FAILED }

    public record RecordedEvent(int sequence, Instant at, String type, SyncEvent data) {}

    private final String id;
    private final Facet facet;
    private final int doiCount;
    private final List<String> warnings;
    private final Instant submittedAt = Instant.now();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final List<RecordedEvent> events = Collections.synchronizedList(new ArrayList<>());

    private volatile State state = State.QUEUED;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile DryRunSummary dryRunSummary;
    private volatile BatchSummary summary;
    private volatile String error;

    public SyncJob(String id, Facet facet, int doiCount, List<String> warnings) {
        this.id = id;
        this.facet = facet;
        this.doiCount = doiCount;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    void record(SyncEvent event) {
        synchronized (events) {
            events.add(new RecordedEvent(events.size() + 1, Instant.now(), event.type(), event));
        }
        if (event instanceof SyncEvent.DryRunCompleted) {
            dryRunSummary = ((SyncEvent.DryRunCompleted) event).summary();
        }
    }

    void markRunning() {
        startedAt = Instant.now();
        state = State.RUNNING;
    }

    void complete(BatchSummary result) {
        summary = result;
        finishedAt = Instant.now();
        if (result.aborted()) state = State.ABORTED;
        else if (result.cancelled()) state = State.CANCELLED;
        else state = State.COMPLETED;
    }

    void fail(String message) {
        error = message;
        finishedAt = Instant.now();
        state = State.FAILED;
    }

    boolean requestCancel() {
        if (state != State.QUEUED && state != State.RUNNING) return false;
        cancelRequested.set(true);
        return true;
    }

    boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public String getId() { return id; }
    public Facet getFacet() { return facet; }
    public int getDoiCount() { return doiCount; }
    public List<String> getWarnings() { return warnings; }
    public Instant getSubmittedAt() { return submittedAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public State getState() { return state; }
    public DryRunSummary getDryRunSummary() { return dryRunSummary; }
    public BatchSummary getSummary() { return summary; }
    public String getError() { return error; }

    public List<RecordedEvent> getEvents() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }
}
