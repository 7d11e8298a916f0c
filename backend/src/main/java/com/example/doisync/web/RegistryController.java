package com.example.doisync.web;

import com.example.doisync.registry.RegistryException;
import com.example.doisync.registry.RemoteMetadataStore;
import com.example.doisync.registry.SchemaUpgradeEngine;
import com.example.doisync.web.dto.ErrorResponse;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

@RestController
@RequestMapping("/api/registry")
public class RegistryController {
    private static final Logger log = LoggerFactory.getLogger(RegistryController.class);

    private final RemoteMetadataStore remote;
    private final SchemaUpgradeEngine upgradeEngine;

    public RegistryController(RemoteMetadataStore remote, SchemaUpgradeEngine upgradeEngine) {
        this.remote = remote;
        this.upgradeEngine = upgradeEngine;
    }

    // DOIs contain a slash, so prefix and suffix arrive as separate segments
    @GetMapping("/dois/{prefix}/{suffix}/schema-assessment")
    public ResponseEntity<?> schemaAssessment(@PathVariable("prefix") String prefix, @PathVariable("suffix") String suffix) {
        String doi = prefix + "/" + suffix;
        try {
            Optional<ObjectNode> document = remote.fetch(doi);
            if (document.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse("DOI " + doi + " not found in registry"));
            }
            return ResponseEntity.ok(upgradeEngine.assess(doi, document.get()));
        } catch (RegistryException ex) {
            log.warn("Schema assessment for {} failed: {}", doi, ex.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse(ex.getMessage()));
        }
    }
}
