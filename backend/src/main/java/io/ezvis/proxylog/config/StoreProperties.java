package io.ezvis.proxylog.config;

import io.ezvis.proxylog.repository.StoreDialect;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "ezvis.store")
public class StoreProperties {

    private StoreDialect dialect = StoreDialect.H2;

    private String table = "requests";

    /**
     * Create the table and indexes on startup when missing.
     */
    private boolean initializeSchema = true;
}
