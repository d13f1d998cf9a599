package io.ezvis.proxylog.config;

import io.ezvis.proxylog.repository.RequestStore;
import io.ezvis.proxylog.repository.StorageException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "ezvis.store", name = "initialize-schema", havingValue = "true", matchIfMissing = true)
public class StoreSchemaInitializer {

    private final RequestStore store;

    public StoreSchemaInitializer(RequestStore store) {
        this.store = store;
    }

    @PostConstruct
    public void init() {
        try {
            store.ensureSchema();
        } catch (StorageException e) {
            // every import ensures the schema again before reading its source
            log.warn("Store schema init skipped: {}", e.getMessage(), e);
        }
    }
}
