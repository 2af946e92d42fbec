package dev.jobmatcher.job;

import dev.jobmatcher.ai.JobSeniority;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Enrichment of one posting under one enrichment version.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_enrichments", uniqueConstraints = {
        @UniqueConstraint(name = "uk_job_enrichments_job_version", columnNames = {"jobId", "enrichmentVersion"})
})
public class JobEnrichment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String jobId;

    @Column(nullable = false)
    private int enrichmentVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private JobSeniority seniority;

    @Column(nullable = false, length = 2000)
    private String summary;

    @Column(nullable = false, length = 65535)
    private String descriptionMarkdown;

    @Column(nullable = false)
    private boolean aiGenerated;

    @Column(nullable = false)
    private Instant createdAt;
}
