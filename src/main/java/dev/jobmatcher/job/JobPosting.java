package dev.jobmatcher.job;

import dev.jobmatcher.persistence.JsonMapConverter;
import dev.jobmatcher.persistence.StringListConverter;
import dev.jobmatcher.profile.Platform;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A scraped job posting. Stored once per (team, platform, platform job id) and never
 * mutated afterwards; enrichment and scores live in their own tables.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "jobs", uniqueConstraints = {
        @UniqueConstraint(name = "uk_jobs_platform_job", columnNames = {"teamId", "platform", "platformJobId"})
}, indexes = {
        @Index(name = "idx_jobs_team_created_at", columnList = "teamId,createdAt")
})
public class JobPosting {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false)
    private String teamId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Platform platform;

    @Column(nullable = false)
    private String platformJobId;

    @Column(nullable = false, length = 1000)
    private String title;

    @Column(nullable = false, length = 65535)
    private String description;

    @Column(length = 2048)
    private String applyUrl;

    private Instant postedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BudgetType budgetType;

    private BigDecimal hourlyMin;
    private BigDecimal hourlyMax;
    private BigDecimal fixedBudgetMin;
    private BigDecimal fixedBudgetMax;

    @Column(nullable = false, length = 3)
    private String currency;

    private String clientCountry;
    private BigDecimal clientRating;
    private Integer clientHires;
    private Boolean clientPaymentVerified;

    @Convert(converter = StringListConverter.class)
    @Column(length = 4000)
    private List<String> skills;

    private String category;

    @Convert(converter = JsonMapConverter.class)
    @Column(length = 65535)
    private Map<String, Object> extra;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    void assignId() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
