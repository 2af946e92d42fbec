package dev.jobmatcher;

import dev.jobmatcher.job.BudgetType;
import dev.jobmatcher.job.JobPosting;
import dev.jobmatcher.profile.ContractType;
import dev.jobmatcher.profile.ContractTypePreference;
import dev.jobmatcher.profile.NormalizedExperience;
import dev.jobmatcher.profile.NormalizedPreferences;
import dev.jobmatcher.profile.NormalizedProfile;
import dev.jobmatcher.profile.NormalizedSkill;
import dev.jobmatcher.profile.Platform;
import dev.jobmatcher.profile.RemotePreference;
import dev.jobmatcher.profile.SeniorityLevel;
import dev.jobmatcher.spec.SearchLocation;
import dev.jobmatcher.spec.SearchSpec;
import dev.jobmatcher.spec.WeightedKeyword;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Shared test data.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    public static final String TEAM_ID = "team-1";

    private Fixtures() {
    }

    public static NormalizedProfile profile(String userId, int version) {
        return new NormalizedProfile(
                userId,
                TEAM_ID,
                version,
                "Ana Souza",
                "Backend engineer",
                "America/Sao_Paulo",
                84,
                SeniorityLevel.SENIOR,
                List.of(new NormalizedSkill("java", "Java", 5, 7.0),
                        new NormalizedSkill("spring_boot", "Spring Boot", 4, 5.0)),
                List.of(new NormalizedSkill("postgresql", "PostgreSQL", 3, 4.0)),
                List.of("microservices"),
                List.of(new NormalizedExperience("Senior Backend Engineer", "Acme", 36, true, List.of()),
                        new NormalizedExperience("Backend Developer", "Globex", 48, false, List.of())),
                List.of("Backend Engineer"),
                new NormalizedPreferences(List.of(Platform.UPWORK),
                        new NormalizedPreferences.RateRange(50.0, 90.0, "USD"),
                        null, 3, RemotePreference.REMOTE_ONLY, ContractTypePreference.ANY),
                NOW);
    }

    public static SearchSpec searchSpec(String userId, int version) {
        return new SearchSpec(
                userId,
                TEAM_ID,
                version,
                List.of(new WeightedKeyword("Backend Engineer", 10), new WeightedKeyword("Java Developer", 8)),
                List.of(new WeightedKeyword("java", 10), new WeightedKeyword("spring boot", 9)),
                List.of("unpaid"),
                List.of(new SearchLocation("BR", null, null)),
                List.of(SeniorityLevel.SENIOR),
                RemotePreference.REMOTE_ONLY,
                List.of(ContractType.FREELANCE, ContractType.CONTRACT),
                50.0,
                90.0,
                null,
                List.of(Platform.UPWORK),
                SearchSpec.DEFAULT_MAX_RESULTS_PER_PLATFORM,
                NOW);
    }

    public static JobPosting job(String id, String title, List<String> skills) {
        return JobPosting.builder()
                .id(id)
                .teamId(TEAM_ID)
                .platform(Platform.UPWORK)
                .platformJobId("up-" + id)
                .title(title)
                .description("<p>We need a " + title + " with " + String.join(", ", skills) + ".</p>")
                .budgetType(BudgetType.HOURLY)
                .hourlyMin(new BigDecimal("60"))
                .hourlyMax(new BigDecimal("80"))
                .currency("USD")
                .clientRating(new BigDecimal("4.8"))
                .clientHires(12)
                .clientPaymentVerified(true)
                .skills(skills)
                .createdAt(NOW)
                .build();
    }

    /**
     * Clock that only moves when told to.
     */
    public static final class MutableClock extends Clock {

        private Instant instant;

        public MutableClock(Instant start) {
            this.instant = start;
        }

        public void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
