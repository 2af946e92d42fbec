package dev.jobmatcher;

import dev.jobmatcher.queue.DrainSummary;
import dev.jobmatcher.queue.QueueStats;
import dev.jobmatcher.run.AgentRunView;

import java.util.List;

/**
 * What one worker invocation did.
 */
public record WorkerSummary(DrainSummary drain, int jobsEnriched, int jobsRejected, QueueStats queue,
        List<AgentRunView> enrichmentRuns) {
}
