package com.example.doisync.sync;

/**
 * Per-identifier result of the fetch and detect phase.
 *
 * @param valid      false when the document could not be fetched
 * @param hasChanges only meaningful when valid
 */
public record DryRunResult(String doi, boolean valid, boolean hasChanges, String message) {
}
