package com.example.doisync.web;

import com.example.doisync.entity.SyncAuditEntry;
import com.example.doisync.model.Facet;
import com.example.doisync.service.JobRejectedException;
import com.example.doisync.service.SyncJob;
import com.example.doisync.service.SyncJobService;
import com.example.doisync.source.InvalidDesiredStateException;
import com.example.doisync.source.JsonDesiredStateSource;
import com.example.doisync.source.ParsedDesiredState;
import com.example.doisync.sync.SyncRequest;
import com.example.doisync.web.dto.ErrorResponse;
import com.example.doisync.web.dto.JobSubmission;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/sync")
public class SyncController {
    private final SyncJobService jobService;
    private final JsonDesiredStateSource desiredStateSource;

    public SyncController(SyncJobService jobService, JsonDesiredStateSource desiredStateSource) {
        this.jobService = jobService;
        this.desiredStateSource = desiredStateSource;
    }

    @PostMapping("/{facet}/jobs")
    public ResponseEntity<?> submit(@PathVariable("facet") String facetName,
                                    @RequestParam(name = "dryRunOnly", required = false) Boolean dryRunOnly,
                                    @RequestBody JsonNode body) {
        Facet facet;
        ParsedDesiredState parsed;
        try {
            facet = Facet.parse(facetName);
            parsed = desiredStateSource.parse(facet, body);
        } catch (IllegalArgumentException | InvalidDesiredStateException ex) {
            return ResponseEntity.badRequest().body(new ErrorResponse(ex.getMessage()));
        }
        try {
            SyncJob job = jobService.submit(new SyncRequest(facet, parsed.entries(), dryRunOnly), parsed.warnings());
            return ResponseEntity.accepted().body(new JobSubmission(job.getId(), job.getDoiCount(), parsed.warnings()));
        } catch (JobRejectedException ex) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(ex.getMessage()));
        }
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<SyncJob> job(@PathVariable("jobId") String jobId) {
        return jobService.find(jobId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable("jobId") String jobId) {
        if (jobService.find(jobId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (!jobService.cancel(jobId)) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse("Job " + jobId + " has already finished"));
        }
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/audit")
    public List<SyncAuditEntry> audit(@RequestParam("doi") String doi) {
        return jobService.auditTrail(doi);
    }
}
