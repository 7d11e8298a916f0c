package com.example.doisync.repository;

import com.example.doisync.entity.SyncAuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SyncAuditRepository extends JpaRepository<SyncAuditEntry, Long> {

    List<SyncAuditEntry> findByDoiOrderByRecordedAtDesc(String doi);

    List<SyncAuditEntry> findByJobIdOrderByIdAsc(String jobId);

    long countByStatus(String status);
}
