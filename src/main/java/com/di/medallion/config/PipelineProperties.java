package com.di.medallion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Run-level settings (from application.yml, prefix {@code medallion.pipeline}).
 */
@Data
@ConfigurationProperties(prefix = "medallion.pipeline")
public class PipelineProperties {

    /** Display name used in logs and the run summary. */
    private String name = "Employee Data Pipeline";

    /** Root directory; the bronze, silver and gold layers live underneath it. */
    private String dataDir = "data";

    /** When true the transform stage keeps only rows whose {@code CurrentFlag} is true. */
    private boolean activeOnly = false;

    /** Quality-gate row-count floor. */
    private int minRowCount = 1;

    /** Zone of the reference clock and of file timestamps. */
    private String zone = "UTC";

    public Path getDataPath() {
        return Paths.get(dataDir);
    }

    public Path layerPath(String layer) {
        return getDataPath().resolve(layer);
    }
}
