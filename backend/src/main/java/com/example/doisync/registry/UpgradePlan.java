package com.example.doisync.registry;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Either a repaired document ready to be written, or the reason the upgrade was abandoned.
 */
public record UpgradePlan(ObjectNode document, List<String> repairs, String abortMessage) {

    public UpgradePlan {
        repairs = repairs == null ? List.of() : List.copyOf(repairs);
    }

    public static UpgradePlan ready(ObjectNode document, List<String> repairs) {
        return new UpgradePlan(document, repairs, null);
    }

    public static UpgradePlan aborted(String message) {
        return new UpgradePlan(null, List.of(), message);
    }

    public boolean isAborted() {
        return document == null;
    }
}
