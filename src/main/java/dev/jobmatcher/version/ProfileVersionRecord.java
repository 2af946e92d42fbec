package dev.jobmatcher.version;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Ledger row holding the current profile version of one user.
 * Writes are guarded by optimistic locking so two concurrent bumps cannot both win.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "profile_versions", indexes = {
        @Index(name = "idx_profile_versions_team", columnList = "teamId")
})
public class ProfileVersionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String teamId;

    @Column(nullable = false, unique = true)
    private String userId;

    @Column(nullable = false)
    private int currentVersion;

    @Version
    private Long lockVersion;

    @Column(nullable = false)
    private Instant updatedAt;
}
