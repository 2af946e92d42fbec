package dev.jobmatcher.job;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts reported by one matching pass.
 */
public record MatchingOutcome(int jobsEmbedded, int jobsShortlisted, int jobsEnriched, int jobsRanked) {

    public static MatchingOutcome nothingShortlisted(int jobsEmbedded) {
        return new MatchingOutcome(jobsEmbedded, 0, 0, 0);
    }

    /**
     * Run outputs keyed by their wire names.
     */
    public Map<String, Object> toOutputs() {
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("jobs_embedded", jobsEmbedded);
        outputs.put("jobs_shortlisted", jobsShortlisted);
        outputs.put("jobs_enriched", jobsEnriched);
        outputs.put("jobs_ranked", jobsRanked);
        return outputs;
    }
}
