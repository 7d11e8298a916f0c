package com.example.doisync.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SchemaAssessment(
        String doi,
        String currentSchema,
        Status status,
        List<String> reasons,
        Map<String, Object> missingFields,
        int funderCount
) {
    public enum Status {
        UPGRADEABLE,
        NOT_UPGRADEABLE,
        ALREADY_CURRENT
    }

    public SchemaAssessment {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        missingFields = missingFields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(missingFields));
    }
}
