package com.example.doisync.model;

import java.util.Locale;

/**
 * Editable metadata aspect of a DOI record. Each facet has its own comparison and update rules.
 */
public enum Facet {
    CREATORS("Creators"),
    CONTRIBUTORS("Contributors"),
    PUBLISHER("Publisher");

    private final String label;

    Facet(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts enum names and labels in any case, e.g. "creators" or "CONTRIBUTORS".
     */
    public static Facet parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Facet must not be blank");
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        for (Facet f : values()) {
            if (f.name().equals(v)) return f;
        }
        throw new IllegalArgumentException("Unknown facet: " + value);
    }
}
