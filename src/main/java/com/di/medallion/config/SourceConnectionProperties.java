package com.di.medallion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Source database settings (from application.yml, prefix {@code medallion.source}).
 * Defaults come from the {@code SQL_SERVER}, {@code SQL_DATABASE}, {@code SQL_USERNAME}
 * and {@code SQL_PASSWORD} environment variables.
 */
@Data
@ConfigurationProperties(prefix = "medallion.source")
public class SourceConnectionProperties {

    private String  server   = "localhost";
    private String  database = "AdventureWorksDW2022";
    private String  schema   = "dbo";
    private String  username = "";
    private String  password = "";
    private boolean encrypt  = true;
    private boolean trustServerCertificate = true;
    private int     maximumPoolSize = 2;
    private long    connectionTimeoutMs = 30_000L;
    private int     loginTimeoutSeconds = 15;

    public SourceSettings toSettings() {
        return new SourceSettings(server, database, schema, username, password,
                encrypt, trustServerCertificate, maximumPoolSize, connectionTimeoutMs, loginTimeoutSeconds);
    }
}
