package dev.jobmatcher.job;

import dev.jobmatcher.ai.ScoreBreakdown;
import dev.jobmatcher.version.VersionedArtifact;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One ranking of a posting for a user at a profile version and tightness.
 * Rows are appended, never updated; the newest row per key is the live one.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_scores", indexes = {
        @Index(name = "idx_job_scores_key", columnList = "jobId,userId,profileVersion,tightness"),
        @Index(name = "idx_job_scores_user_version", columnList = "userId,profileVersion")
})
public class JobScore implements VersionedArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String jobId;

    @Column(nullable = false)
    private String teamId;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private int profileVersion;

    @Column(nullable = false)
    private int tightness;

    @Column(nullable = false)
    private double score;

    private double skillMatch;
    private double budgetFit;
    private double clientQuality;
    private double scopeFit;
    private double winProbability;

    @Column(length = 2000)
    private String reasoning;

    @Column(length = 36)
    private String agentRunId;

    @Column(nullable = false)
    private Instant createdAt;

    public ScoreBreakdown breakdown() {
        return new ScoreBreakdown(skillMatch, budgetFit, clientQuality, scopeFit, winProbability);
    }
}
