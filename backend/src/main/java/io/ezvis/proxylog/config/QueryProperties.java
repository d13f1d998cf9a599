package io.ezvis.proxylog.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "ezvis.query")
public class QueryProperties {

    /**
     * Maximum rows returned by the user agent breakdown, 0 for all families.
     */
    private int userAgentLimit = 0;
}
