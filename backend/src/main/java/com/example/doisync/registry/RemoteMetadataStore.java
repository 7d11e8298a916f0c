package com.example.doisync.registry;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Full-document access to the DOI registry.
 */
public interface RemoteMetadataStore {

    /**
     * Cheap reachability probe run once before a batch.
     *
     * @throws RegistryNetworkException when the registry cannot be reached
     * @throws RegistryApiException when it answers with an error status
     */
    void verifyAccess();

    /**
     * Fetch the complete document ({@code {"data":{"type":"dois","attributes":{...}}}}).
     * Empty when the DOI is unknown or the request timed out.
     *
     * @throws RegistryAuthenticationException on rejected credentials
     * @throws RegistryNetworkException on connection failures
     * @throws RegistryApiException on other error statuses
     */
    Optional<ObjectNode> fetch(String doi);

    /**
     * Replace the complete document. Recognized schema errors are repaired and retried once internally.
     *
     * @throws RegistryAuthenticationException on rejected credentials
     * @throws RegistryNetworkException on connection failures
     */
    WriteResult write(String doi, ObjectNode document);
}
