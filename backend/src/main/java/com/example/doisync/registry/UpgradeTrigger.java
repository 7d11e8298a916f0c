package com.example.doisync.registry;

import java.util.Locale;

/**
 * Known registry validation error signatures (HTTP 422, first error title).
 */
public enum UpgradeTrigger {
    /** Document still declares a retired schema version; full upgrade. */
    DEPRECATED_SCHEMA,
    /** Document declares no schema version at all; funder migration and stamp only. */
    MISSING_SCHEMA_VERSION,
    /** Mandatory fields are blank; reported, never repaired. */
    BLANK_FIELDS,
    NONE;

    public static UpgradeTrigger classify(String errorTitle) {
        if (errorTitle == null) return NONE;
        String t = errorTitle.toLowerCase(Locale.ROOT);
        if (t.contains("schema") && t.contains("no longer supported")) return DEPRECATED_SCHEMA;
        if (t.contains("no matching global declaration")) return MISSING_SCHEMA_VERSION;
        if (t.contains("can't be blank")) return BLANK_FIELDS;
        return NONE;
    }

    public boolean isUpgrade() {
        return this == DEPRECATED_SCHEMA || this == MISSING_SCHEMA_VERSION;
    }
}
