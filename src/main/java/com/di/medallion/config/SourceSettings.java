package com.di.medallion.config;

import java.io.Serializable;

/**
 * Immutable connection settings for the source SQL Server database, passed to
 * the extraction adapter and the pool factory. Blank username or password
 * selects integrated (Windows) authentication.
 */
public record SourceSettings(String server, String database, String schema, String username, String password,
                             boolean encrypt, boolean trustServerCertificate,
                             int maximumPoolSize, long connectionTimeoutMs, int loginTimeoutSeconds)
        implements Serializable {

    public boolean usesIntegratedAuthentication() {
        return username == null || username.isBlank() || password == null || password.isBlank();
    }

    public String jdbcUrl() {
        StringBuilder url = new StringBuilder("jdbc:sqlserver://").append(server)
                .append(";databaseName=").append(database)
                .append(";encrypt=").append(encrypt)
                .append(";trustServerCertificate=").append(trustServerCertificate)
                .append(";loginTimeout=").append(loginTimeoutSeconds);
        if (usesIntegratedAuthentication()) {
            url.append(";integratedSecurity=true");
        }
        return url.toString();
    }

    @Override
    public String toString() {
        return "SourceSettings[server=" + server + ", database=" + database + ", schema=" + schema
                + ", auth=" + (usesIntegratedAuthentication() ? "integrated" : "sql:" + username) + "]";
    }
}
