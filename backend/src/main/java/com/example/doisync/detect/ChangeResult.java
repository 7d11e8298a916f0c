package com.example.doisync.detect;

import java.util.List;

public record ChangeResult(boolean hasChanges, String description) {

    static final int MAX_LISTED = 3;

    public static ChangeResult unchanged(String message) {
        return new ChangeResult(false, message);
    }

    public static ChangeResult changed(String message) {
        return new ChangeResult(true, message);
    }

    /**
     * First three diffs joined with "; " plus a count of the rest, or the sentinel when there are none.
     */
    public static ChangeResult fromDiffs(List<String> diffs, String unchangedMessage) {
        if (diffs == null || diffs.isEmpty()) {
            return unchanged(unchangedMessage);
        }
        String desc = String.join("; ", diffs.subList(0, Math.min(MAX_LISTED, diffs.size())));
        if (diffs.size() > MAX_LISTED) {
            desc += " (+ " + (diffs.size() - MAX_LISTED) + " more)";
        }
        return changed(desc);
    }
}
