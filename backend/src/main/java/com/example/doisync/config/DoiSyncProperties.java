package com.example.doisync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "doisync")
public class DoiSyncProperties {
    private Registry registry = new Registry();
    private Local local = new Local();
    private Upgrade upgrade = new Upgrade();
    private Jobs jobs = new Jobs();

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Local getLocal() {
        return local;
    }

    public void setLocal(Local local) {
        this.local = local;
    }

    public Upgrade getUpgrade() {
        return upgrade;
    }

    public void setUpgrade(Upgrade upgrade) {
        this.upgrade = upgrade;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public void setJobs(Jobs jobs) {
        this.jobs = jobs;
    }

    public static class Registry {
        private String endpoint = "https://api.datacite.org";
        private String testEndpoint = "https://api.test.datacite.org";
        private boolean useTestApi;
        private String username;
        private String password;
        private long timeoutMs = 30000L;
        private String editorBaseUrl = "https://doi.datacite.org/dois/";

        public String resolveBaseUrl() {
            String base = useTestApi ? testEndpoint : endpoint;
            return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getTestEndpoint() {
            return testEndpoint;
        }

        public void setTestEndpoint(String testEndpoint) {
            this.testEndpoint = testEndpoint;
        }

        public boolean isUseTestApi() {
            return useTestApi;
        }

        public void setUseTestApi(boolean useTestApi) {
            this.useTestApi = useTestApi;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getEditorBaseUrl() {
            return editorBaseUrl;
        }

        public void setEditorBaseUrl(String editorBaseUrl) {
            this.editorBaseUrl = editorBaseUrl;
        }
    }

    public static class Local {
        private boolean enabled;
        private String jdbcUrl;
        private String username;
        private String password;
        private Pool pool = new Pool();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public Pool getPool() {
            return pool;
        }

        public void setPool(Pool pool) {
            this.pool = pool;
        }
    }

    public static class Pool {
        private int maxSize = 5;
        private int minIdle = 1;
        private long connectionTimeoutMs = 10000L;

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public int getMinIdle() {
            return minIdle;
        }

        public void setMinIdle(int minIdle) {
            this.minIdle = minIdle;
        }

        public long getConnectionTimeoutMs() {
            return connectionTimeoutMs;
        }

        public void setConnectionTimeoutMs(long connectionTimeoutMs) {
            this.connectionTimeoutMs = connectionTimeoutMs;
        }
    }

    public static class Upgrade {
        private String schemaVersion = "http://datacite.org/schema/kernel-4";
        private String defaultResourceTypeGeneral = "Dataset";
        private String defaultPublisher = "GFZ Data Services";

        public String getSchemaVersion() {
            return schemaVersion;
        }

        public void setSchemaVersion(String schemaVersion) {
            this.schemaVersion = schemaVersion;
        }

        public String getDefaultResourceTypeGeneral() {
            return defaultResourceTypeGeneral;
        }

        public void setDefaultResourceTypeGeneral(String defaultResourceTypeGeneral) {
            this.defaultResourceTypeGeneral = defaultResourceTypeGeneral;
        }

        public String getDefaultPublisher() {
            return defaultPublisher;
        }

        public void setDefaultPublisher(String defaultPublisher) {
            this.defaultPublisher = defaultPublisher;
        }
    }

    public static class Jobs {
        private int queueCapacity = 10;
        private long retentionMinutes = 240L;
        private int maxRetained = 100;

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public long getRetentionMinutes() {
            return retentionMinutes;
        }

        public void setRetentionMinutes(long retentionMinutes) {
            this.retentionMinutes = retentionMinutes;
        }

        public int getMaxRetained() {
            return maxRetained;
        }

        public void setMaxRetained(int maxRetained) {
            this.maxRetained = maxRetained;
        }
    }
}
