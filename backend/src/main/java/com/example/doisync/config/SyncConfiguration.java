package com.example.doisync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class SyncConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SyncConfiguration.class);

    public static final String REGISTRY_MEDIA_TYPE = "application/vnd.api+json";

    @Bean
    public SyncConfig syncConfig(Environment env, DoiSyncProperties properties) {
        boolean localEnabled = ConfigUtils.getBooleanFlag(env, "doisync.local.enabled", "DOISYNC_LOCAL_ENABLED",
                properties.getLocal().isEnabled());
        boolean dryRunOnly = ConfigUtils.getBooleanFlag(env, "doisync.dry-run-only", "DOISYNC_DRY_RUN_ONLY", false);
        log.info("Local database synchronization {}", localEnabled ? "enabled" : "disabled (registry-only mode)");
        return new SyncConfig(localEnabled, properties.getRegistry().getEditorBaseUrl(), dryRunOnly);
    }

    @Bean("registryRestTemplate")
    public RestTemplate registryRestTemplate(RestTemplateBuilder builder, DoiSyncProperties properties, Environment env) {
        DoiSyncProperties.Registry registry = properties.getRegistry();
        long timeoutMs = ConfigUtils.getLong(env, "doisync.registry.timeout-ms", "DOISYNC_REGISTRY_TIMEOUT_MS", registry.getTimeoutMs());
        Duration timeout = Duration.ofMillis(timeoutMs);
        RestTemplateBuilder configured = builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .defaultHeader(HttpHeaders.ACCEPT, REGISTRY_MEDIA_TYPE);
        if (registry.getUsername() != null && !registry.getUsername().isBlank()) {
            configured = configured.basicAuthentication(registry.getUsername(), registry.getPassword());
        } else {
            log.warn("No registry credentials configured; registry requests will be anonymous");
        }
        log.info("Registry client targeting {} (timeout {} ms)", registry.resolveBaseUrl(), timeoutMs);
        return configured.build();
    }
}
