package dev.jobmatcher.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores scraped postings. A posting is written once; repeated ingestion of the same
 * platform job returns the stored row untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobPostingService {

    private static final String DEFAULT_CURRENCY = "USD";

    private final JobPostingRepository jobPostingRepository;
    private final Clock clock;

    @Transactional
    public JobPosting ingest(RawJob raw) {
        if (raw.platform() == null || raw.platformJobId() == null || raw.platformJobId().isBlank()) {
            throw new IllegalArgumentException("Raw job needs a platform and a platform job id");
        }

        Optional<JobPosting> existing = jobPostingRepository.findByTeamIdAndPlatformAndPlatformJobId(
                raw.teamId(), raw.platform(), raw.platformJobId());
        if (existing.isPresent()) {
            log.debug("Job {}:{} already stored as {}", raw.platform(), raw.platformJobId(), existing.get().getId());
            return existing.get();
        }

        JobPosting posting = JobPosting.builder()
                .teamId(raw.teamId())
                .platform(raw.platform())
                .platformJobId(raw.platformJobId())
                .title(raw.title() != null ? raw.title() : "")
                .description(raw.description() != null ? raw.description() : "")
                .applyUrl(raw.applyUrl())
                .postedAt(raw.postedAt())
                .budgetType(raw.budgetType() != null ? raw.budgetType() : BudgetType.UNKNOWN)
                .hourlyMin(raw.hourlyMin())
                .hourlyMax(raw.hourlyMax())
                .fixedBudgetMin(raw.fixedBudgetMin())
                .fixedBudgetMax(raw.fixedBudgetMax())
                .currency(raw.currency() != null ? raw.currency() : DEFAULT_CURRENCY)
                .clientCountry(raw.clientCountry())
                .clientRating(raw.clientRating())
                .clientHires(raw.clientHires())
                .clientPaymentVerified(raw.clientPaymentVerified())
                .skills(raw.skills() != null ? List.copyOf(raw.skills()) : List.of())
                .category(raw.category())
                .extra(raw.extra() != null ? raw.extra() : Map.of())
                .createdAt(clock.instant())
                .build();

        JobPosting saved = jobPostingRepository.save(posting);
        log.info("Stored job {} ({}:{})", saved.getId(), saved.getPlatform(), saved.getPlatformJobId());
        return saved;
    }

    @Transactional
    public List<JobPosting> ingestAll(List<RawJob> rawJobs) {
        return rawJobs.stream().map(this::ingest).toList();
    }

    /**
     * Plain text version of a posting description for prompts and keyword matching.
     */
    public static String plainText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }
}
