package dev.jobmatcher.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Embedding shortlist and the enrichment runs the worker executes in process.
 * Loaded from application.yml under 'app.matching' prefix.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app.matching")
public class MatchingProperties {

    /**
     * Texts sent per embeddings request.
     */
    @Min(1)
    private int embedBatchSize = 100;

    /**
     * Postings embedded per run at most.
     */
    @Min(1)
    private int embedLimit = 500;

    @Min(1)
    private int shortlistSize = 50;

    /**
     * Postings at or below this cosine similarity are never shortlisted.
     */
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.2;

    /**
     * Users the worker runs an enrichment run for on every pass.
     */
    @Valid
    private List<Target> targets = new ArrayList<>();

    @Data
    public static class Target {
        @NotBlank
        private String teamId;

        @NotBlank
        private String userId;
    }
}
