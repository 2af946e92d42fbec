package dev.jobmatcher.ai;

import java.util.Objects;

public record RankedJob(String jobId, ScoreBreakdown breakdown, String reasoning) {

    public RankedJob {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(breakdown, "breakdown");
    }

    public double score() {
        return breakdown.overall();
    }
}
