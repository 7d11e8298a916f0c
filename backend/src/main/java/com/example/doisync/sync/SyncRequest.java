package com.example.doisync.sync;

import com.example.doisync.model.EntityDescriptor;
import com.example.doisync.model.Facet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One batch: desired rows per DOI in submission order.
 *
 * @param dryRunOnly null means "use the configured default"
 */
public record SyncRequest(Facet facet, Map<String, List<EntityDescriptor>> desired, Boolean dryRunOnly) {

    public SyncRequest {
        if (facet == null) throw new IllegalArgumentException("facet is required");
        LinkedHashMap<String, List<EntityDescriptor>> copy = new LinkedHashMap<>();
        if (desired != null) {
            desired.forEach((doi, rows) -> copy.put(doi, rows == null ? List.of() : List.copyOf(rows)));
        }
        desired = Collections.unmodifiableMap(copy);
    }

    public static SyncRequest of(Facet facet, Map<String, List<EntityDescriptor>> desired) {
        return new SyncRequest(facet, desired, null);
    }
}
