package dev.jobmatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Recompute queue and worker settings.
 * Loaded from application.yml under 'app.recompute' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.recompute")
public class RecomputeProperties {

    private int maxRetries = 3;
    private int defaultPriority = 5;
    private int drainLimit = 100;
    private int enrichLimit = 50;
    private Duration handlerTimeout = Duration.ofMinutes(5);
    private String workerId = "local-worker";
    private int staleScoreLimit = 100;
}
