package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Background run settings: polling cadence and the trigger.dev task API.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.runs")
public class RunProperties {

    private Duration pollInterval = Duration.ofSeconds(5);
    private Duration pollTimeout = Duration.ofMinutes(10);
    private String jobSearchTask = "linkedin-job-search";
    private String jobEnrichmentTask = "job-enrichment";
    private int maxQueries = 5;
    private Trigger trigger = new Trigger();

    @Data
    public static class Trigger {
        private String baseUrl = "https://api.trigger.dev";
        private String secretKey;
        private Duration requestTimeout = Duration.ofSeconds(30);
    }
}
