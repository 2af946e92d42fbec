package dev.jobmatcher.ai;

import java.util.Objects;

/**
 * Enrichment of one posting.
 *
 * @param descriptionMarkdown description rewritten into the sections
 *                            {@link #SECTIONS}, empty sections omitted
 */
public record EnrichedJob(String jobId, JobSeniority seniority, String summary, String descriptionMarkdown) {

    public static final String[] SECTIONS = {
            "Role", "Responsibilities", "Requirements", "Nice to Have", "About the Company"
    };

    public EnrichedJob {
        Objects.requireNonNull(jobId, "jobId");
        if (seniority == null) {
            seniority = JobSeniority.MID;
        }
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("summary must not be blank");
        }
        if (descriptionMarkdown == null || descriptionMarkdown.isBlank()) {
            throw new IllegalArgumentException("description markdown must not be blank");
        }
    }
}
