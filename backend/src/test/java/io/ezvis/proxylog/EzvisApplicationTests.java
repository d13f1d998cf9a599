package io.ezvis.proxylog;

import static org.assertj.core.api.Assertions.assertThat;

import io.ezvis.proxylog.repository.RequestStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class EzvisApplicationTests {

    @Autowired
    private RequestStore store;

    @Test
    void contextLoadsAndSchemaIsReady() {
        assertThat(store.table()).isEqualTo("requests");
        assertThat(store.count()).isGreaterThanOrEqualTo(0);
    }
}
