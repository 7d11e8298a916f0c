package com.example.doisync.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "sync_audit", indexes = @Index(name = "idx_sync_audit_doi", columnList = "doi"))
public class SyncAuditEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(nullable = false, length = 255)
    private String doi;

    @Column(nullable = false, length = 20)
    private String facet;

    @Column(nullable = false, length = 30)
    private String status; // UPDATED, SKIPPED_UNCHANGED, FAILED_*, INCONSISTENT

    @Column(length = 4000)
    private String message;

    private boolean retried;

    @Column(name = "remote_only")
    private boolean remoteOnly;

    @Column(name = "schema_upgraded")
    private boolean schemaUpgraded;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    public SyncAuditEntry() {}

    public SyncAuditEntry(String jobId, String doi, String facet, String status, String message) {
        this.jobId = jobId;
        this.doi = doi;
        this.facet = facet;
        this.status = status;
        this.message = message != null && message.length() > 4000 ? message.substring(0, 4000) : message;
        this.recordedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public String getDoi() { return doi; }
    public void setDoi(String doi) { this.doi = doi; }
    public String getFacet() { return facet; }
    public void setFacet(String facet) { this.facet = facet; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public boolean isRetried() { return retried; }
    public void setRetried(boolean retried) { this.retried = retried; }
    public boolean isRemoteOnly() { return remoteOnly; }
    public void setRemoteOnly(boolean remoteOnly) { this.remoteOnly = remoteOnly; }
    public boolean isSchemaUpgraded() { return schemaUpgraded; }
    public void setSchemaUpgraded(boolean schemaUpgraded) { this.schemaUpgraded = schemaUpgraded; }
    public Instant getRecordedAt() { return recordedAt; }
    public void setRecordedAt(Instant recordedAt) { this.recordedAt = recordedAt; }
}
