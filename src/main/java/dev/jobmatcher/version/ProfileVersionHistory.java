package dev.jobmatcher.version;

import dev.jobmatcher.persistence.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit of version bumps.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "profile_version_history", indexes = {
        @Index(name = "idx_version_history_user", columnList = "userId,toVersion")
})
public class ProfileVersionHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String teamId;

    @Column(nullable = false)
    private String userId;

    @Column(nullable = false)
    private int fromVersion;

    @Column(nullable = false)
    private int toVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private ProfileChangeType changeType;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 65535)
    private Map<String, Object> changeDetails;

    @Column(nullable = false)
    private Instant changedAt;
}
