package dev.jobmatcher.profile;

import dev.jobmatcher.version.VersionedArtifact;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Vector embedding of a user's profile context at one profile version.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "profile_embeddings", indexes = {
        @Index(name = "idx_profile_embeddings_user_version", columnList = "userId,profileVersion")
})
public class ProfileEmbedding implements VersionedArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String teamId;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private int profileVersion;

    @Column(nullable = false)
    private String model;

    @Column(nullable = false)
    private int dimensions;

    /**
     * JSON array of the vector components.
     */
    @Column(nullable = false, length = 65535)
    private String vector;

    @Column(nullable = false)
    private Instant createdAt;
}
