package io.ezvis.proxylog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Import tuning and the optional startup directory import (ezvis.import.*).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ezvis.import")
public class ImportProperties {

    /**
     * Records per bulk append.
     */
    private int batchSize = 5_000;

    /**
     * Lines between two progress reports.
     */
    private int progressInterval = 10_000;

    /**
     * Directory imported at startup; nothing is imported when empty.
     */
    private String directory;

    /**
     * Glob matched against file names inside {@link #directory}.
     */
    private String pattern = "*.log";
}
