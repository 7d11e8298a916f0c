package com.example.doisync.local;

import com.example.doisync.model.Facet;

import java.util.List;
import java.util.Optional;

public interface LocalRecordStore {

    ConnectionCheck testConnection();

    /**
     * Local resource id for a DOI, empty when the DOI is not held locally.
     *
     * @throws LocalStoreException on SQL errors
     */
    Optional<Long> resolve(String doi);

    /**
     * Atomically replace the rows of one facet. Rows of other facets are left untouched.
     * Failures are rolled back and reported in the result.
     *
     * @throws LocalStoreException when the rollback itself fails
     */
    LocalWriteResult replaceFacetRecords(long resourceId, Facet facet, List<LocalRecord> records);

    List<LocalRecord> fetchFacetRecords(long resourceId, Facet facet);
}
