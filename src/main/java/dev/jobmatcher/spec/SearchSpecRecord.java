package dev.jobmatcher.spec;

import dev.jobmatcher.version.VersionedArtifact;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted copy of every generated search spec. Records are never updated; older
 * versions are kept for audit and as a fallback when generation fails.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "search_specs", indexes = {
        @Index(name = "idx_search_specs_user_version", columnList = "userId,profileVersion")
})
public class SearchSpecRecord implements VersionedArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String teamId;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private int profileVersion;

    @Column(nullable = false, length = 65535)
    private String payload;

    @Column(nullable = false)
    private Instant createdAt;
}
