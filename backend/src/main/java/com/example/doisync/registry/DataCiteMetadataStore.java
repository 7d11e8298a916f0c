package com.example.doisync.registry;

import com.example.doisync.config.DoiSyncProperties;
import com.example.doisync.config.SyncConfiguration;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Optional;

/**
 * DataCite REST client. Fetches and replaces whole DOI documents and runs the
 * schema upgrade when a write is rejected for legacy schema reasons.
 */
@Component
public class DataCiteMetadataStore implements RemoteMetadataStore {
    private static final Logger log = LoggerFactory.getLogger(DataCiteMetadataStore.class);

    private static final MediaType API_JSON = MediaType.parseMediaType(SyncConfiguration.REGISTRY_MEDIA_TYPE);
    static final int NO_RESPONSE = 0;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SchemaUpgradeEngine upgradeEngine;
    private final String baseUrl;

    public DataCiteMetadataStore(@Qualifier("registryRestTemplate") RestTemplate restTemplate,
                                 ObjectMapper objectMapper,
                                 SchemaUpgradeEngine upgradeEngine,
                                 DoiSyncProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.upgradeEngine = upgradeEngine;
        this.baseUrl = properties.getRegistry().resolveBaseUrl();
    }

    @Override
    public void verifyAccess() {
        try {
            restTemplate.getForEntity(baseUrl + "/heartbeat", String.class);
        } catch (HttpStatusCodeException ex) {
            int status = ex.getStatusCode().value();
            if (status == 401) {
                throw new RegistryAuthenticationException("Registry rejected the configured credentials (HTTP 401)");
            }
            throw new RegistryApiException("Registry heartbeat failed (HTTP " + status + ")", status);
        } catch (ResourceAccessException ex) {
            throw new RegistryNetworkException("Registry at " + baseUrl + " is not reachable: " + rootMessage(ex), ex);
        }
    }

    @Override
    public Optional<ObjectNode> fetch(String doi) {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(baseUrl + "/dois/{doi}", String.class, doi);
            JsonNode parsed = parse(response.getBody());
            if (parsed == null || !parsed.isObject()) {
                throw new RegistryApiException("Registry returned an unreadable document for " + doi, response.getStatusCode().value());
            }
            return Optional.of((ObjectNode) parsed);
        } catch (HttpStatusCodeException ex) {
            int status = ex.getStatusCode().value();
            if (status == 404) {
                log.debug("DOI {} not found in registry", doi);
                return Optional.empty();
            }
            if (status == 401) {
                throw new RegistryAuthenticationException("Registry authentication failed while fetching " + doi + " (HTTP 401)");
            }
            if (status == 429) {
                throw new RegistryApiException("Registry rate limit exceeded while fetching " + doi, status);
            }
            throw new RegistryApiException("Registry returned HTTP " + status + " for " + doi, status);
        } catch (ResourceAccessException ex) {
            if (isTimeout(ex)) {
                log.warn("Timed out fetching {}; treating as not found", doi);
                return Optional.empty();
            }
            throw new RegistryNetworkException("Registry at " + baseUrl + " is not reachable: " + rootMessage(ex), ex);
        }
    }

    @Override
    public WriteResult write(String doi, ObjectNode document) {
        Exchange first = put(doi, document);
        if (first.isSuccess()) {
            return WriteResult.ok("DOI " + doi + " updated in registry");
        }
        if (first.timedOut()) {
            return WriteResult.failure("Registry request for " + doi + " timed out", NO_RESPONSE);
        }
        if (first.status() == 422) {
            return handleValidationFailure(doi, document, first);
        }
        return WriteResult.failure(describeFailure(doi, first), first.status());
    }

    private WriteResult handleValidationFailure(String doi, ObjectNode document, Exchange rejected) {
        String title = firstErrorTitle(rejected.body());
        UpgradeTrigger trigger = UpgradeTrigger.classify(title);
        if (trigger == UpgradeTrigger.BLANK_FIELDS) {
            Optional<ObjectNode> current = refetch(doi);
            String report = current.map(doc -> upgradeEngine.blankFieldsMessage(doi, doc)).orElse(null);
            return WriteResult.failure(report != null ? report : "validation error for " + doi + ": " + title, 422);
        }
        if (!trigger.isUpgrade()) {
            return WriteResult.failure("validation error for " + doi + ": " + (title.isEmpty() ? "HTTP 422" : title), 422);
        }

        log.warn("Registry rejected {} ({}); attempting schema upgrade", doi, title);
        Optional<ObjectNode> current = refetch(doi);
        if (current.isEmpty()) {
            return WriteResult.failure("could not fetch metadata for schema upgrade of " + doi, 422);
        }
        UpgradePlan plan = upgradeEngine.plan(doi, trigger, current.get(), document);
        if (plan.isAborted()) {
            log.warn("Schema upgrade aborted for {}: {}", doi, plan.abortMessage());
            return WriteResult.failure(plan.abortMessage(), 422);
        }

        Exchange second = put(doi, plan.document());
        if (second.isSuccess()) {
            log.info("Schema upgrade succeeded for {}: {}", doi, plan.repairs());
            return WriteResult.okAfterUpgrade("DOI " + doi + " updated in registry; schema upgraded to kernel-4 ("
                    + String.join("; ", plan.repairs()) + ")");
        }
        String detail = second.timedOut() ? "timeout" : firstErrorTitle(second.body());
        log.warn("Schema upgrade failed for {} (HTTP {}): {}", doi, second.status(), detail);
        return WriteResult.failure("schema upgrade failed for " + doi + " (HTTP " + second.status() + ")"
                + (detail.isEmpty() ? "" : ": " + detail), second.status());
    }

    private Optional<ObjectNode> refetch(String doi) {
        try {
            return fetch(doi);
        } catch (RegistryApiException ex) {
            log.warn("Could not refetch {} for schema upgrade: {}", doi, ex.getMessage());
            return Optional.empty();
        }
    }

    private Exchange put(String doi, ObjectNode document) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(API_JSON);
        headers.setAccept(List.of(API_JSON));
        HttpEntity<String> entity = new HttpEntity<>(serialize(document), headers);
        try {
            ResponseEntity<String> response = restTemplate.exchange(baseUrl + "/dois/{doi}", HttpMethod.PUT, entity, String.class, doi);
            return new Exchange(response.getStatusCode().value(), response.getBody(), false);
        } catch (HttpStatusCodeException ex) {
            int status = ex.getStatusCode().value();
            if (status == 401) {
                throw new RegistryAuthenticationException("Registry authentication failed while updating " + doi + " (HTTP 401)");
            }
            return new Exchange(status, ex.getResponseBodyAsString(), false);
        } catch (ResourceAccessException ex) {
            if (isTimeout(ex)) {
                log.warn("Timed out writing {}", doi);
                return new Exchange(NO_RESPONSE, null, true);
            }
            throw new RegistryNetworkException("Registry at " + baseUrl + " is not reachable: " + rootMessage(ex), ex);
        }
    }

    private String describeFailure(String doi, Exchange ex) {
        switch (ex.status()) {
            case 403:
                return "permission denied for " + doi + " (HTTP 403)";
            case 404:
                return "DOI " + doi + " not found in registry (HTTP 404)";
            case 429:
                return "registry rate limit exceeded for " + doi + " (HTTP 429)";
            default:
                String title = firstErrorTitle(ex.body());
                return "registry returned HTTP " + ex.status() + " for " + doi + (title.isEmpty() ? "" : ": " + title);
        }
    }

    String firstErrorTitle(String body) {
        JsonNode node = parse(body);
        if (node == null) return "";
        return node.path("errors").path(0).path("title").asText("");
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            log.debug("Unparseable registry response: {}", ex.getOriginalMessage());
            return null;
        }
    }

    private String serialize(ObjectNode document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize registry document", ex);
        }
    }

    private static boolean isTimeout(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) return true;
        }
        return false;
    }

    private static String rootMessage(Throwable ex) {
        Throwable t = ex;
        while (t.getCause() != null && t.getCause() != t) t = t.getCause();
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private record Exchange(int status, String body, boolean timedOut) {
        boolean isSuccess() {
            return !timedOut && status >= 200 && status < 300;
        }
    }
}
