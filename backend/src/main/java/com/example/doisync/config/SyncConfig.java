package com.example.doisync.config;

/**
 * Settings handed to the orchestrator at construction time.
 *
 * @param localSyncEnabled      whether the local database is written before the registry
 * @param registryEditorBaseUrl base of the registry's manual editor, used in remediation messages
 * @param dryRunOnly            default for requests that do not say whether to stop after the dry run
 */
public record SyncConfig(boolean localSyncEnabled, String registryEditorBaseUrl, boolean dryRunOnly) {

    public static final String DEFAULT_EDITOR_BASE_URL = "https://doi.datacite.org/dois/";

    public SyncConfig {
        registryEditorBaseUrl = registryEditorBaseUrl == null || registryEditorBaseUrl.isBlank()
                ? DEFAULT_EDITOR_BASE_URL : registryEditorBaseUrl;
    }

    public static SyncConfig remoteOnly() {
        return new SyncConfig(false, DEFAULT_EDITOR_BASE_URL, false);
    }

    public static SyncConfig withLocalSync() {
        return new SyncConfig(true, DEFAULT_EDITOR_BASE_URL, false);
    }

    public String editorLink(String doi) {
        return (registryEditorBaseUrl.endsWith("/") ? registryEditorBaseUrl : registryEditorBaseUrl + "/") + doi;
    }
}
