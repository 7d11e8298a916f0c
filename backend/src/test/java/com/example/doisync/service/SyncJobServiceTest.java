package com.example.doisync.service;

import com.example.doisync.config.DoiSyncProperties;
import com.example.doisync.config.SyncConfig;
import com.example.doisync.entity.SyncAuditEntry;
import com.example.doisync.local.LocalRecordStore;
import com.example.doisync.model.EntityDescriptor;
import com.example.doisync.model.Facet;
import com.example.doisync.registry.RemoteMetadataStore;
import com.example.doisync.registry.WriteResult;
import com.example.doisync.repository.SyncAuditRepository;
import com.example.doisync.sync.FacetStrategies;
import com.example.doisync.sync.SyncOrchestrator;
import com.example.doisync.sync.SyncRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SyncJobServiceTest {

    private static final String DOI = "10.5880/GFZ.4.1.2019.001";

    private RemoteMetadataStore remote;
    private SyncAuditRepository auditRepository;
    private MeterRegistry meterRegistry;
    private MetricsService metricsService;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        remote = mock(RemoteMetadataStore.class);
        auditRepository = mock(SyncAuditRepository.class);
        meterRegistry = new SimpleMeterRegistry();
        ObjectProvider<MeterRegistry> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(meterRegistry);
        metricsService = new MetricsService(provider);
    }

    private SyncJobService service(SyncOrchestrator orchestrator, TaskExecutor executor) {
        return new SyncJobService(orchestrator, executor, auditRepository, metricsService, new DoiSyncProperties());
    }

    private SyncOrchestrator orchestrator() {
        return new SyncOrchestrator(SyncConfig.remoteOnly(), remote, mock(LocalRecordStore.class), FacetStrategies.defaults());
    }

    private static SyncRequest request() {
        return SyncRequest.of(Facet.PUBLISHER, Map.of(DOI, List.of(EntityDescriptor.publisher("GFZ Data Services", null, null, null, null))));
    }

    private static ObjectNode documentWithPublisher(String publisher) {
        ObjectNode doc = new ObjectMapper().createObjectNode();
        doc.putObject("data").putObject("attributes").put("publisher", publisher);
        return doc;
    }

    @Test
    void completedJobIsAuditedAndCounted() {
        when(remote.fetch(DOI)).thenReturn(Optional.of(documentWithPublisher("GFZ Potsdam")));
        when(remote.write(eq(DOI), any())).thenReturn(WriteResult.ok("DOI updated in registry"));
        SyncJobService service = service(orchestrator(), new SyncTaskExecutor());

        SyncJob job = service.submit(request(), List.of("a warning"));

        assertThat(job.getState()).isEqualTo(SyncJob.State.COMPLETED);
        assertThat(job.getSummary().updated()).isEqualTo(1);
        assertThat(job.getDryRunSummary().changedCount()).isEqualTo(1);
        assertThat(job.getWarnings()).containsExactly("a warning");
        assertThat(job.getEvents()).extracting(SyncJob.RecordedEvent::type)
                .contains("validation", "progress", "dry_run_complete", "remote_update", "outcome", "batch_finished");
        assertThat(job.getEvents().get(0).sequence()).isEqualTo(1);
        assertThat(service.find(job.getId())).containsSame(job);

        ArgumentCaptor<SyncAuditEntry> saved = ArgumentCaptor.forClass(SyncAuditEntry.class);
        verify(auditRepository, times(1)).save(saved.capture());
        assertThat(saved.getValue().getStatus()).isEqualTo("UPDATED");
        assertThat(saved.getValue().getFacet()).isEqualTo("PUBLISHER");
        assertThat(meterRegistry.get(MetricsService.OUTCOMES).tag("status", "UPDATED").counter().count()).isEqualTo(1.0);
    }

    @Test
    void auditFailureDoesNotFailTheJob() {
        when(remote.fetch(DOI)).thenReturn(Optional.of(documentWithPublisher("GFZ Data Services")));
        when(auditRepository.save(any())).thenThrow(new DataAccessResourceFailureException("audit db down"));

        SyncJob job = service(orchestrator(), new SyncTaskExecutor()).submit(request(), List.of());

        assertThat(job.getState()).isEqualTo(SyncJob.State.COMPLETED);
        assertThat(job.getSummary().skipped()).isEqualTo(1);
    }

    @Test
    void unexpectedOrchestratorFailureMarksJobFailed() {
        SyncOrchestrator broken = mock(SyncOrchestrator.class);
        when(broken.run(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        SyncJob job = service(broken, new SyncTaskExecutor()).submit(request(), List.of());

        assertThat(job.getState()).isEqualTo(SyncJob.State.FAILED);
        assertThat(job.getError()).isEqualTo("boom");
        assertThat(job.getFinishedAt()).isNotNull();
    }

    @Test
    void fullQueueIsRejectedAndJobForgotten() {
        TaskExecutor full = task -> {
            throw new TaskRejectedException("queue full");
        };
        SyncJobService service = service(orchestrator(), full);

        assertThatThrownBy(() -> service.submit(request(), List.of()))
                .isInstanceOf(JobRejectedException.class);
    }

    @Test
    void cancellationOnlyAppliesToUnfinishedJobs() {
        TaskExecutor parked = task -> { };
        SyncJobService queued = service(orchestrator(), parked);
        SyncJob waiting = queued.submit(request(), List.of());

        assertThat(queued.cancel(waiting.getId())).isTrue();
        assertThat(waiting.isCancelRequested()).isTrue();
        assertThat(queued.cancel("no-such-job")).isFalse();

        when(remote.fetch(DOI)).thenReturn(Optional.of(documentWithPublisher("GFZ Data Services")));
        SyncJobService immediate = service(orchestrator(), new SyncTaskExecutor());
        SyncJob done = immediate.submit(request(), List.of());
        assertThat(immediate.cancel(done.getId())).isFalse();
    }

    @Test
    void cancelledBeforeStartFinishesAsCancelled() {
        SyncJobService service = service(orchestrator(), task -> { });
        SyncJob job = service.submit(request(), List.of());
        job.requestCancel();

        service.runJob(job, request());

        assertThat(job.getState()).isEqualTo(SyncJob.State.CANCELLED);
        verify(remote, times(0)).fetch(DOI);
    }
}
