package com.example.doisync.sync;

import com.example.doisync.config.SyncConfig;
import com.example.doisync.detect.ChangeResult;
import com.example.doisync.local.ConnectionCheck;
import com.example.doisync.local.LocalRecordStore;
import com.example.doisync.local.LocalStoreException;
import com.example.doisync.local.LocalWriteResult;
import com.example.doisync.model.EntityDescriptor;
import com.example.doisync.model.Facet;
import com.example.doisync.registry.RegistryApiException;
import com.example.doisync.registry.RegistryAuthenticationException;
import com.example.doisync.registry.RegistryDocuments;
import com.example.doisync.registry.RegistryNetworkException;
import com.example.doisync.registry.RemoteMetadataStore;
import com.example.doisync.registry.WriteResult;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Runs one batch for one facet: validation, a dry run that fetches and diffs every DOI,
 * then a local-first update of the changed DOIs with a single registry retry when the
 * local store has already committed.
 * <p>
 * DOIs are processed strictly one after another on the calling thread. Authentication and
 * connectivity failures against the registry abort the batch; everything else is scoped to one DOI.
 */
@Component
public class SyncOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    static final String REMOTE_ONLY_NOTE = "not found in local database, remote-only update";

    private final SyncConfig config;
    private final RemoteMetadataStore remote;
    private final LocalRecordStore local;
    private final FacetStrategies strategies;

    public SyncOrchestrator(SyncConfig config, RemoteMetadataStore remote, LocalRecordStore local, FacetStrategies strategies) {
        this.config = config;
        this.remote = remote;
        this.local = local;
        this.strategies = strategies;
    }

    public BatchSummary run(SyncRequest request, SyncEventListener listener, BooleanSupplier cancelled) {
        Facet facet = request.facet();
        FacetStrategy strategy = strategies.forFacet(facet);
        boolean dryRunOnly = request.dryRunOnly() != null ? request.dryRunOnly() : config.dryRunOnly();
        Batch batch = new Batch(facet, request.desired().size(), dryRunOnly, listener);

        if (request.desired().isEmpty()) {
            batch.emit(new SyncEvent.Validation("No DOIs submitted"));
            return batch.finish();
        }
        log.info("Starting {} sync for {} DOI(s) (local sync {}, dry run only {})",
                facet.label(), batch.total, config.localSyncEnabled() ? "on" : "off", dryRunOnly);

        BatchSummary aborted = validate(batch);
        if (aborted != null) return aborted;

        // dry run: one fetch per DOI, cached as both diff and write basis
        Map<String, ObjectNode> documents = new LinkedHashMap<>();
        List<String> changed = new ArrayList<>();
        List<DryRunResult> results = new ArrayList<>();
        int valid = 0;
        int index = 0;
        for (Map.Entry<String, List<EntityDescriptor>> entry : request.desired().entrySet()) {
            if (cancelled.getAsBoolean()) {
                batch.cancelled = true;
                break;
            }
            String doi = entry.getKey();
            batch.emit(new SyncEvent.Progress(++index, batch.total, "Checking " + doi));
            Optional<ObjectNode> document;
            try {
                document = remote.fetch(doi);
            } catch (RegistryAuthenticationException ex) {
                return batch.abort(FatalKind.FATAL_AUTH, "Registry authentication failed: " + ex.getMessage());
            } catch (RegistryNetworkException ex) {
                return batch.abort(FatalKind.FATAL_NETWORK, "Registry not reachable: " + ex.getMessage());
            } catch (RegistryApiException ex) {
                String msg = "Could not fetch " + doi + ": " + ex.getMessage();
                results.add(new DryRunResult(doi, false, false, msg));
                batch.record(SyncOutcome.of(doi, facet, SyncStatus.FAILED_REMOTE, msg));
                continue;
            }
            if (document.isEmpty()) {
                String msg = "DOI " + doi + " not found in registry";
                results.add(new DryRunResult(doi, false, false, msg));
                batch.record(SyncOutcome.of(doi, facet, SyncStatus.FAILED_NOT_FOUND, msg));
                continue;
            }
            valid++;
            documents.put(doi, document.get());
            ChangeResult diff;
            try {
                diff = strategy.detect(RegistryDocuments.attributes(document.get()), entry.getValue());
            } catch (RuntimeException ex) {
                log.error("Change detection failed for {}", doi, ex);
                String msg = "Change detection failed for " + doi + ": " + ex.getMessage();
                results.add(new DryRunResult(doi, true, false, msg));
                batch.record(SyncOutcome.of(doi, facet, SyncStatus.FAILED_REMOTE, msg));
                continue;
            }
            if (diff.hasChanges()) {
                results.add(new DryRunResult(doi, true, true, "Changes detected: " + diff.description()));
                changed.add(doi);
            } else {
                results.add(new DryRunResult(doi, true, false, diff.description()));
                batch.record(SyncOutcome.of(doi, facet, SyncStatus.SKIPPED_UNCHANGED, doi + ": " + diff.description()));
            }
        }
        DryRunSummary dryRun = new DryRunSummary(valid, results.size() - valid, results);
        batch.emit(new SyncEvent.DryRunCompleted(dryRun));
        log.info("Dry run for {}: {} valid, {} invalid, {} changed", facet.label(), dryRun.validCount(),
                dryRun.invalidCount(), changed.size());

        if (dryRunOnly || batch.cancelled) {
            return batch.finish();
        }

        int step = 0;
        for (String doi : changed) {
            if (cancelled.getAsBoolean()) {
                batch.cancelled = true;
                break;
            }
            batch.emit(new SyncEvent.Progress(++step, changed.size(), "Updating " + doi));
            batch.committedLocally = null;
            try {
                batch.record(syncOne(batch, strategy, doi, request.desired().get(doi), documents.get(doi)));
            } catch (RegistryAuthenticationException ex) {
                return abortDuringUpdate(batch, doi, FatalKind.FATAL_AUTH,
                        "Registry authentication failed while updating " + doi + ": " + ex.getMessage());
            } catch (RegistryNetworkException ex) {
                return abortDuringUpdate(batch, doi, FatalKind.FATAL_NETWORK,
                        "Registry not reachable while updating " + doi + ": " + ex.getMessage());
            } catch (RuntimeException ex) {
                log.error("Unexpected failure syncing {}", doi, ex);
                String reason = "unexpected error: " + ex.getMessage();
                if (doi.equals(batch.committedLocally)) {
                    batch.record(localOnlyOutcome(doi, facet, reason));
                } else {
                    batch.record(SyncOutcome.of(doi, facet, SyncStatus.FAILED_REMOTE,
                            "Unexpected error for " + doi + ": " + ex.getMessage()));
                }
            }
        }
        return batch.finish();
    }

    /**
     * A DOI whose local transaction already committed is recorded as inconsistent before the batch stops.
     */
    private BatchSummary abortDuringUpdate(Batch batch, String doi, FatalKind kind, String reason) {
        if (doi.equals(batch.committedLocally)) {
            batch.record(localOnlyOutcome(doi, batch.facet, "batch aborted: " + reason));
        }
        return batch.abort(kind, reason);
    }

    private SyncOutcome localOnlyOutcome(String doi, Facet facet, String reason) {
        String msg = "CRITICAL INCONSISTENCY for " + doi + ": local committed, remote not written (" + reason
                + "). Reconcile manually: " + config.editorLink(doi);
        log.error(msg);
        return new SyncOutcome(doi, facet, SyncStatus.INCONSISTENT, msg, false, false, false);
    }

    private BatchSummary validate(Batch batch) {
        batch.emit(new SyncEvent.Validation("Checking registry access"));
        try {
            remote.verifyAccess();
        } catch (RegistryAuthenticationException ex) {
            return batch.abort(FatalKind.FATAL_AUTH, "Registry authentication failed: " + ex.getMessage());
        } catch (RegistryNetworkException | RegistryApiException ex) {
            return batch.abort(FatalKind.FATAL_NETWORK, "Registry not available: " + ex.getMessage());
        }
        if (!config.localSyncEnabled()) {
            batch.emit(new SyncEvent.Validation("Local database sync disabled; registry only"));
            return null;
        }
        batch.emit(new SyncEvent.Validation("Checking local database connection"));
        ConnectionCheck check = local.testConnection();
        if (!check.ok()) {
            return batch.abort(FatalKind.FATAL_LOCAL_UNAVAILABLE, "Local database is not reachable (" + check.message() + "). "
                    + "Check the network or VPN connection, the database credentials and whether the database server is running. "
                    + "To sync the registry only, set doisync.local.enabled=false.");
        }
        batch.emit(new SyncEvent.Validation(check.message()));
        return null;
    }

    /**
     * Local transaction first, then the registry. Registry exceptions propagate as batch-fatal.
     */
    private SyncOutcome syncOne(Batch batch, FacetStrategy strategy, String doi, List<EntityDescriptor> desired, ObjectNode cached) {
        Facet facet = strategy.facet();
        ObjectNode payload;
        try {
            payload = strategy.buildRemotePayload(cached, desired);
        } catch (IllegalArgumentException ex) {
            return SyncOutcome.of(doi, facet, SyncStatus.FAILED_REMOTE, "Cannot build registry update for " + doi + ": " + ex.getMessage());
        }

        boolean localCommitted = false;
        boolean remoteOnly = false;
        String localNote = "";
        if (config.localSyncEnabled()) {
            Optional<Long> resourceId;
            try {
                resourceId = local.resolve(doi);
            } catch (LocalStoreException ex) {
                return SyncOutcome.of(doi, facet, SyncStatus.FAILED_LOCAL, "Local database error for " + doi + ": " + ex.getMessage());
            }
            if (resourceId.isEmpty()) {
                remoteOnly = true;
                log.warn("{} {}", doi, REMOTE_ONLY_NOTE);
                batch.emit(new SyncEvent.LocalUpdate(doi, "DOI " + doi + " " + REMOTE_ONLY_NOTE));
            } else {
                LocalWriteResult result;
                try {
                    result = local.replaceFacetRecords(resourceId.get(), facet, strategy.buildLocalRecords(desired));
                } catch (LocalStoreException ex) {
                    log.error("Local update for {} failed and could not be rolled back", doi, ex);
                    return SyncOutcome.of(doi, facet, SyncStatus.FAILED_LOCAL, "Local update failed for " + doi + ": " + ex.getMessage());
                }
                batch.emit(new SyncEvent.LocalUpdate(doi, result.message()));
                if (!result.success()) {
                    return SyncOutcome.of(doi, facet, SyncStatus.FAILED_LOCAL,
                            "Local update failed for " + doi + " (registry not touched): " + result.message());
                }
                localCommitted = true;
                batch.committedLocally = doi;
                if (!result.warnings().isEmpty()) {
                    localNote = " (local warnings: " + String.join("; ", result.warnings()) + ")";
                }
            }
        }

        WriteResult first = remote.write(doi, payload);
        batch.emit(new SyncEvent.RemoteUpdate(doi, first.message()));
        if (first.success()) {
            return new SyncOutcome(doi, facet, SyncStatus.UPDATED,
                    updatedMessage(doi, facet, remoteOnly, first) + localNote, false, remoteOnly, first.schemaUpgraded());
        }
        if (!localCommitted) {
            return new SyncOutcome(doi, facet, SyncStatus.FAILED_REMOTE,
                    "Registry update failed for " + doi + ": " + first.message(), false, remoteOnly, false);
        }

        log.warn("Registry update failed for {} after local commit, retrying once: {}", doi, first.message());
        WriteResult retry = remote.write(doi, payload);
        batch.emit(new SyncEvent.RemoteUpdate(doi, retry.message()));
        if (retry.success()) {
            return new SyncOutcome(doi, facet, SyncStatus.UPDATED,
                    updatedMessage(doi, facet, false, retry) + ", succeeded on retry" + localNote, true, false, retry.schemaUpgraded());
        }
        String msg = "CRITICAL INCONSISTENCY for " + doi + ": local committed, remote failed twice (first: "
                + first.message() + "; retry: " + retry.message() + "). Reconcile manually: " + config.editorLink(doi);
        log.error(msg);
        return new SyncOutcome(doi, facet, SyncStatus.INCONSISTENT, msg, true, false, false);
    }

    private static String updatedMessage(String doi, Facet facet, boolean remoteOnly, WriteResult write) {
        StringBuilder sb = new StringBuilder(doi).append(": ").append(facet.label()).append(" updated");
        if (remoteOnly) sb.append(" (").append(REMOTE_ONLY_NOTE).append(")");
        if (write.schemaUpgraded()) sb.append("; schema upgraded to kernel-4");
        return sb.toString();
    }

    /**
     * Mutable tally for one run.
     */
    private static final class Batch {
        final Facet facet;
        final int total;
        final boolean dryRunOnly;
        final SyncEventListener listener;
        final List<IdentifierMessage> failures = new ArrayList<>();
        final List<IdentifierMessage> skips = new ArrayList<>();
        final List<SyncOutcome> outcomes = new ArrayList<>();
        int updated;
        boolean cancelled;
        // DOI of the current update step once its local transaction has committed
        String committedLocally;

        Batch(Facet facet, int total, boolean dryRunOnly, SyncEventListener listener) {
            this.facet = facet;
            this.total = total;
            this.dryRunOnly = dryRunOnly;
            this.listener = listener == null ? SyncEventListener.noop() : listener;
        }

        void emit(SyncEvent event) {
            listener.onEvent(event);
        }

        void record(SyncOutcome outcome) {
            outcomes.add(outcome);
            if (outcome.status() == SyncStatus.UPDATED) {
                updated++;
            } else if (outcome.status() == SyncStatus.SKIPPED_UNCHANGED) {
                skips.add(new IdentifierMessage(outcome.doi(), outcome.message()));
            } else {
                failures.add(new IdentifierMessage(outcome.doi(), outcome.message()));
            }
            if (outcome.status().isFailure()) {
                log.warn("{}: {}", outcome.status(), outcome.message());
            } else {
                log.info("{}: {}", outcome.status(), outcome.message());
            }
            emit(new SyncEvent.Outcome(outcome));
        }

        BatchSummary abort(FatalKind kind, String message) {
            log.error("{} sync aborted ({}): {}", facet.label(), kind, message);
            emit(new SyncEvent.BatchAborted(kind, message));
            return summary(true, kind, message);
        }

        BatchSummary finish() {
            BatchSummary summary = summary(false, null, null);
            log.info("{} sync finished: {} updated, {} failed, {} skipped{}", facet.label(), summary.updated(),
                    summary.failed(), summary.skipped(), cancelled ? " (cancelled)" : "");
            emit(new SyncEvent.BatchFinished(summary));
            return summary;
        }

        private BatchSummary summary(boolean aborted, FatalKind kind, String message) {
            return new BatchSummary(facet, total, updated, failures.size(), skips.size(), failures, skips, outcomes,
                    aborted, kind, message, cancelled, dryRunOnly);
        }
    }
}
