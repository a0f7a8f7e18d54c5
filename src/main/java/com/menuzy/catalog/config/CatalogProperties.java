package com.menuzy.catalog.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.transaction.annotation.Isolation;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "menuzy.catalog")
public class CatalogProperties {

    /** Used when a load call does not pass its own timeout. */
    private Duration defaultTimeout = Duration.ofSeconds(30);

    private Isolation isolation = Isolation.SERIALIZABLE;

    private Seed seed = new Seed();

    @Data
    public static class Seed {
        private boolean enabled = false;
        private String location = "classpath:seed/sample-catalog.json";
    }
}
