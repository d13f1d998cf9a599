package io.ezvis.proxylog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EzvisApplication {

    public static void main(String[] args) {
        SpringApplication.run(EzvisApplication.class, args);
    }
}
