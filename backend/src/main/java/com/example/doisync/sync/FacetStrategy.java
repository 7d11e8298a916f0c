package com.example.doisync.sync;

import com.example.doisync.detect.ChangeResult;
import com.example.doisync.local.LocalRecord;
import com.example.doisync.model.EntityDescriptor;
import com.example.doisync.model.Facet;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Facet-specific parts of a sync: change detection, the local row shape and the registry payload.
 * Everything else (ordering, transactions, retries) lives in {@link SyncOrchestrator}.
 */
public interface FacetStrategy {

    Facet facet();

    ChangeResult detect(JsonNode attributes, List<EntityDescriptor> desired);

    List<LocalRecord> buildLocalRecords(List<EntityDescriptor> desired);

    /**
     * Copy of {@code cachedDocument} with this facet replaced by {@code desired}. The cached document is not modified.
     *
     * @throws IllegalArgumentException when the desired values cannot be expressed in the registry
     */
    ObjectNode buildRemotePayload(ObjectNode cachedDocument, List<EntityDescriptor> desired);
}
