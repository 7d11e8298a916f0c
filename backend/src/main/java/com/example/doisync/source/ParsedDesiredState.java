package com.example.doisync.source;

import com.example.doisync.model.EntityDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ParsedDesiredState(Map<String, List<EntityDescriptor>> entries, List<String> warnings) {

    public ParsedDesiredState {
        entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
