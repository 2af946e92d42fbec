package dev.jobmatcher.job;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Vector embedding of a posting's title and description under one embedding model.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_embeddings", uniqueConstraints = {
        @UniqueConstraint(name = "uk_job_embeddings_job_model", columnNames = {"jobId", "model"})
}, indexes = {
        @Index(name = "idx_job_embeddings_team_model", columnList = "teamId,model")
})
public class JobEmbedding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String jobId;

    @Column(nullable = false)
    private String teamId;

    @Column(nullable = false)
    private String model;

    @Column(nullable = false)
    private int dimensions;

    /**
     * JSON array of the vector components.
     */
    @Column(nullable = false, length = 65535)
    private String vector;

    /**
     * Hex SHA-256 of the embedded text.
     */
    @Column(nullable = false, length = 64)
    private String sourceTextHash;

    @Column(nullable = false, length = 200)
    private String sourceTextPreview;

    @Column(nullable = false)
    private Instant createdAt;
}
