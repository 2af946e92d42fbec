package dev.jobmatcher.job;

import dev.jobmatcher.profile.Platform;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A job posting as delivered by a scraper, before it is stored.
 *
 * @param extra fields the scraper returned that have no column of their own
 */
@Builder
public record RawJob(
        String teamId,
        Platform platform,
        String platformJobId,
        String title,
        String description,
        String applyUrl,
        Instant postedAt,
        BudgetType budgetType,
        BigDecimal hourlyMin,
        BigDecimal hourlyMax,
        BigDecimal fixedBudgetMin,
        BigDecimal fixedBudgetMax,
        String currency,
        String clientCountry,
        BigDecimal clientRating,
        Integer clientHires,
        Boolean clientPaymentVerified,
        List<String> skills,
        String category,
        Map<String, Object> extra) {
}
