package com.example.doisync.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.metrics.micrometer.MicrometerMetricsTrackerFactory;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Owns the pooled connections to the local metadata database (resource / resourceagent / role / contactinfo).
 * The pool is created on first use so a disabled or unreachable database never blocks startup.
 */
@Component
public class LocalDbConfig {
    private static final Logger log = LoggerFactory.getLogger(LocalDbConfig.class);

    static final String POOL_NAME = "doisync-local";
    // Used when no jdbc-url is configured (dev and tests)
    static final String H2_FALLBACK_URL = "jdbc:h2:mem:doisync_local;MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1;INIT=RUNSCRIPT FROM 'classpath:local-h2-schema.sql'";

    private final DoiSyncProperties properties;
    private final MeterRegistry meterRegistry;
    private volatile HikariDataSource dataSource;

    public LocalDbConfig(DoiSyncProperties properties, ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.properties = properties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public Connection getConnection() throws SQLException {
        return dataSource().getConnection();
    }

    public String describeTarget() {
        String url = resolveJdbcUrl();
        int q = url.indexOf('?');
        return q > 0 ? url.substring(0, q) : url;
    }

    String resolveJdbcUrl() {
        String url = properties.getLocal().getJdbcUrl();
        return url == null || url.isBlank() ? H2_FALLBACK_URL : url;
    }

    private HikariDataSource dataSource() {
        HikariDataSource ds = dataSource;
        if (ds == null) {
            synchronized (this) {
                ds = dataSource;
                if (ds == null) {
                    ds = createDataSource();
                    dataSource = ds;
                }
            }
        }
        return ds;
    }

    private HikariDataSource createDataSource() {
        DoiSyncProperties.Local local = properties.getLocal();
        HikariConfig config = new HikariConfig();
        String url = resolveJdbcUrl();
        config.setJdbcUrl(url);
        if (url.equals(H2_FALLBACK_URL)) {
            config.setUsername("sa");
            config.setPassword("");
        } else {
            config.setUsername(local.getUsername());
            config.setPassword(local.getPassword());
        }
        config.setMaximumPoolSize(local.getPool().getMaxSize());
        config.setMinimumIdle(local.getPool().getMinIdle());
        config.setConnectionTimeout(local.getPool().getConnectionTimeoutMs());
        // start without a connection; reachability is checked explicitly before each batch
        config.setInitializationFailTimeout(-1);
        config.setPoolName(POOL_NAME);
        if (meterRegistry != null) {
            try {
                config.setMetricsTrackerFactory(new MicrometerMetricsTrackerFactory(meterRegistry));
            } catch (NoClassDefFoundError | Exception ex) {
                log.debug("Hikari Micrometer tracker unavailable: {}", ex.getMessage());
            }
        }
        HikariDataSource created = new HikariDataSource(config);
        registerPoolGauges(created);
        log.info("Created local database pool {} for {}", POOL_NAME, describeTarget());
        return created;
    }

    private void registerPoolGauges(HikariDataSource ds) {
        if (meterRegistry == null) return;
        try {
            Gauge.builder("doisync_local_pool_active", ds, s -> s.getHikariPoolMXBean().getActiveConnections())
                    .description("Active connections in the local metadata database pool")
                    .tag("pool", POOL_NAME)
                    .register(meterRegistry);
            Gauge.builder("doisync_local_pool_idle", ds, s -> s.getHikariPoolMXBean().getIdleConnections())
                    .description("Idle connections in the local metadata database pool")
                    .tag("pool", POOL_NAME)
                    .register(meterRegistry);
        } catch (Exception ex) {
            log.debug("Skipping local pool gauges: {}", ex.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        HikariDataSource ds = dataSource;
        if (ds != null) {
            ds.close();
        }
    }
}
