package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "app.cache")
public class CacheProperties {

    /**
     * memory (single process) or jpa (shared table).
     */
    private String backend = "memory";

    /**
     * Default time to live of cached search specs. Unset means entries never expire.
     */
    private Duration ttl;
}
