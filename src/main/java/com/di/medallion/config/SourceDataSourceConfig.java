package com.di.medallion.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Builds the source connection pool from {@link SourceSettings}.
 *
 * <p>The pool is created lazily ({@code initializationFailTimeout = -1}) so an
 * unreachable server does not prevent startup; reachability is reported by the
 * orchestrator's pre-flight check instead.
 */
@Slf4j
@Configuration
public class SourceDataSourceConfig {

    private static final String DRIVER_CLASS = "com.microsoft.sqlserver.jdbc.SQLServerDriver";

    @Bean
    public SourceSettings sourceSettings(SourceConnectionProperties properties) {
        SourceSettings settings = properties.toSettings();
        log.info("[SOURCE] {}", settings);
        return settings;
    }

    @Bean(destroyMethod = "close")
    public HikariDataSource sourceDataSource(SourceSettings settings) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(settings.jdbcUrl());
        hikariConfig.setDriverClassName(DRIVER_CLASS);
        if (!settings.usesIntegratedAuthentication()) {
            hikariConfig.setUsername(settings.username());
            hikariConfig.setPassword(settings.password());
        }
        hikariConfig.setMaximumPoolSize(Math.max(1, settings.maximumPoolSize()));
        hikariConfig.setMinimumIdle(0);
        hikariConfig.setConnectionTimeout(settings.connectionTimeoutMs());
        hikariConfig.setReadOnly(true);
        hikariConfig.setInitializationFailTimeout(-1);
        hikariConfig.setPoolName("MedallionSource-" + sanitize(settings.server() + "_" + settings.database()));

        log.info("[POOL] Creating | server={} database={} auth={} maxPoolSize={}",
                settings.server(), settings.database(),
                settings.usesIntegratedAuthentication() ? "integrated" : "sql",
                hikariConfig.getMaximumPoolSize());
        return new HikariDataSource(hikariConfig);
    }

    @Bean
    public JdbcTemplate sourceJdbcTemplate(DataSource sourceDataSource) {
        return new JdbcTemplate(sourceDataSource);
    }

    private static String sanitize(String key) {
        String safe = key.replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        return safe.isEmpty() ? "pool" : safe;
    }
}
