package com.example.doisync.service;

import com.example.doisync.config.DoiSyncProperties;
import com.example.doisync.entity.SyncAuditEntry;
import com.example.doisync.repository.SyncAuditRepository;
import com.example.doisync.sync.BatchSummary;
import com.example.doisync.sync.SyncEvent;
import com.example.doisync.sync.SyncOrchestrator;
import com.example.doisync.sync.SyncOutcome;
import com.example.doisync.sync.SyncRequest;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Accepts batches, runs them one at a time on the sync executor and keeps their job views
 * for a while after they finish. Every outcome is also written to the audit table.
 */
@Service
public class SyncJobService {
    private static final Logger log = LoggerFactory.getLogger(SyncJobService.class);

    private final SyncOrchestrator orchestrator;
    private final TaskExecutor executor;
    private final SyncAuditRepository auditRepository;
    private final MetricsService metricsService;
    private final Cache<String, SyncJob> jobs;

    public SyncJobService(SyncOrchestrator orchestrator,
                          @Qualifier("syncExecutor") TaskExecutor executor,
                          SyncAuditRepository auditRepository,
                          MetricsService metricsService,
                          DoiSyncProperties properties) {
        this.orchestrator = orchestrator;
        this.executor = executor;
        this.auditRepository = auditRepository;
        this.metricsService = metricsService;
        DoiSyncProperties.Jobs cfg = properties.getJobs();
        this.jobs = Caffeine.newBuilder()
                .maximumSize(cfg.getMaxRetained())
                .expireAfterWrite(cfg.getRetentionMinutes(), TimeUnit.MINUTES)
                .build();
    }

    /**
     * Queue a batch. Returns immediately with the job; the batch runs on the sync executor.
     *
     * @throws JobRejectedException when the executor queue is full
     */
    public SyncJob submit(SyncRequest request, List<String> warnings) {
        SyncJob job = new SyncJob(UUID.randomUUID().toString(), request.facet(), request.desired().size(), warnings);
        jobs.put(job.getId(), job);
        try {
            executor.execute(() -> runJob(job, request));
        } catch (TaskRejectedException ex) {
            jobs.invalidate(job.getId());
            log.warn("Rejected {} sync job: executor queue is full", request.facet().label());
            throw new JobRejectedException("Sync queue is full, try again later", ex);
        }
        log.info("Queued {} sync job {} for {} DOI(s)", request.facet().label(), job.getId(), request.desired().size());
        return job;
    }

    void runJob(SyncJob job, SyncRequest request) {
        job.markRunning();
        try {
            BatchSummary summary = orchestrator.run(request, event -> onEvent(job, event), job::isCancelRequested);
            job.complete(summary);
        } catch (RuntimeException ex) {
            log.error("Sync job {} failed unexpectedly", job.getId(), ex);
            job.fail(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    private void onEvent(SyncJob job, SyncEvent event) {
        job.record(event);
        if (event instanceof SyncEvent.Outcome) {
            SyncOutcome outcome = ((SyncEvent.Outcome) event).outcome();
            metricsService.recordOutcome(outcome);
            audit(job, outcome);
        }
    }

    private void audit(SyncJob job, SyncOutcome outcome) {
        SyncAuditEntry entry = new SyncAuditEntry(job.getId(), outcome.doi(), outcome.facet().name(),
                outcome.status().name(), outcome.message());
        entry.setRetried(outcome.retried());
        entry.setRemoteOnly(outcome.remoteOnly());
        entry.setSchemaUpgraded(outcome.schemaUpgraded());
        try {
            auditRepository.save(entry);
        } catch (RuntimeException ex) {
            // the outcome itself stays in the job view
            log.warn("Could not write audit entry for {}: {}", outcome.doi(), ex.getMessage());
        }
    }

    public Optional<SyncJob> find(String jobId) {
        return Optional.ofNullable(jobs.getIfPresent(jobId));
    }

    /**
     * @return false when the job is unknown or already finished
     */
    public boolean cancel(String jobId) {
        SyncJob job = jobs.getIfPresent(jobId);
        if (job == null) return false;
        boolean accepted = job.requestCancel();
        if (accepted) log.info("Cancellation requested for sync job {}", jobId);
        return accepted;
    }

    public List<SyncAuditEntry> auditTrail(String doi) {
        return auditRepository.findByDoiOrderByRecordedAtDesc(doi == null ? "" : doi.trim());
    }
}
