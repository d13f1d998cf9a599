package io.ezvis.proxylog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings read only when {@code ezvis.store.dialect=clickhouse}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ezvis.clickhouse")
public class ClickHouseProperties {

    /** e.g. {@code jdbc:clickhouse://localhost:8123/default} */
    private String url = "";

    private String user = "default";

    private String password = "";

    private int connectTimeoutMs = 5_000;

    /** Bulk inserts of large batches can take a while. */
    private int socketTimeoutMs = 300_000;
}
