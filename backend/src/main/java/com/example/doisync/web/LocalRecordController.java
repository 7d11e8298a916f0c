package com.example.doisync.web;

import com.example.doisync.local.LocalRecord;
import com.example.doisync.local.LocalRecordStore;
import com.example.doisync.local.LocalStoreException;
import com.example.doisync.model.Facet;
import com.example.doisync.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * Read-back of the rows a sync wrote to the local database, for checking a job's result.
 */
@RestController
@RequestMapping("/api/local")
public class LocalRecordController {
    private static final Logger log = LoggerFactory.getLogger(LocalRecordController.class);

    private final LocalRecordStore local;

    public LocalRecordController(LocalRecordStore local) {
        this.local = local;
    }

    @GetMapping("/dois/{prefix}/{suffix}/{facet}")
    public ResponseEntity<?> facetRecords(@PathVariable("prefix") String prefix,
                                          @PathVariable("suffix") String suffix,
                                          @PathVariable("facet") String facetName) {
        Facet facet;
        try {
            facet = Facet.parse(facetName);
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest().body(new ErrorResponse(ex.getMessage()));
        }
        String doi = prefix + "/" + suffix;
        try {
            Optional<Long> resourceId = local.resolve(doi);
            if (resourceId.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("DOI " + doi + " not found in local database"));
            }
            List<LocalRecord> records = local.fetchFacetRecords(resourceId.get(), facet);
            return ResponseEntity.ok(records);
        } catch (LocalStoreException ex) {
            log.warn("Reading {} of {} from local database failed: {}", facet.label(), doi, ex.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(ex.getMessage()));
        }
    }
}
