package dev.jobmatcher.config;

import dev.jobmatcher.ai.BatchMode;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for structured generation, enrichment and ranking.
 * Loaded from application.yml under 'app.ai' prefix.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app.ai")
public class AiProperties {

    /**
     * openai or none. With none every generation step falls back to its deterministic
     * heuristic implementation.
     */
    private String provider = "none";

    private OpenAi openai = new OpenAi();

    @Min(1)
    private int enrichBatchSize = 5;

    @Min(1)
    private int rankBatchSize = 5;

    private BatchMode batchMode = BatchMode.STRICT;
    private Duration requestTimeout = Duration.ofSeconds(120);

    /**
     * Bump when the enrichment prompt changes so every posting is enriched again.
     */
    @Min(1)
    private int enrichmentVersion = 1;

    @Data
    public static class OpenAi {
        private String apiKey;
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4.1-mini";
        private String searchSpecModel = "gpt-4o-mini";
        private String embeddingModel = "text-embedding-3-small";
    }
}
