package dev.jobmatcher;

import dev.jobmatcher.ai.BatchOutcome;
import dev.jobmatcher.ai.EnrichedJob;
import dev.jobmatcher.config.MatchingProperties;
import dev.jobmatcher.config.RecomputeProperties;
import dev.jobmatcher.job.JobEnrichmentService;
import dev.jobmatcher.metrics.MatcherMetrics;
import dev.jobmatcher.queue.DrainSummary;
import dev.jobmatcher.queue.QueueStats;
import dev.jobmatcher.queue.RecomputeQueueService;
import dev.jobmatcher.queue.RecomputeWorker;
import dev.jobmatcher.run.AgentRunStatus;
import dev.jobmatcher.run.AgentRunView;
import dev.jobmatcher.run.EnrichmentRunService;
import dev.jobmatcher.run.RunTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One pass of the background worker: drain the recompute queue, enrich postings that have
 * no enrichment for the current enrichment version, then run an enrichment run for every
 * configured user.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerRunner {

  private static final String SEPARATOR = "========================================";

  private final RecomputeWorker recomputeWorker;
  private final RecomputeQueueService queueService;
  private final JobEnrichmentService jobEnrichmentService;
  private final EnrichmentRunService enrichmentRunService;
  private final RecomputeProperties properties;
  private final MatchingProperties matchingProperties;
  private final MatcherMetrics metrics;

  @Value("${worker.metrics-wait-seconds:0}")
  private int metricsWaitSeconds;

  public WorkerSummary execute() {
    log.info(SEPARATOR);
    log.info("Job Matcher worker starting ({})", properties.getWorkerId());
    log.info(SEPARATOR);

    try {
      DrainSummary drain = recomputeWorker.drain(properties.getDrainLimit(), properties.getWorkerId(),
          properties.getHandlerTimeout());

      BatchOutcome<EnrichedJob> enrichment = jobEnrichmentService.enrichPending(properties.getEnrichLimit()).block();
      int enriched = enrichment != null ? enrichment.results().size() : 0;
      int rejected = enrichment != null ? enrichment.rejectedIds().size() : 0;

      List<AgentRunView> runs = runEnrichment();

      QueueStats stats = queueService.stats();
      metrics.updateLastRunStats(drain.completed() + drain.skipped(), drain.failed(), enriched);

      log.info(SEPARATOR);
      log.info("Job Matcher worker completed");
      log.info("Queue: {} claimed, {} completed, {} skipped, {} failed", drain.claimed(), drain.completed(),
          drain.skipped(), drain.failed());
      log.info("Jobs enriched: {} ({} rejected)", enriched, rejected);
      log.info("Enrichment runs: {} ({} failed)", runs.size(),
          runs.stream().filter(run -> run.status() == AgentRunStatus.FAILED).count());
      log.info("Backlog: {} pending, {} failed", stats.pending(), stats.failed());
      log.info(SEPARATOR);

      handleMetricsWait();

      return new WorkerSummary(drain, enriched, rejected, stats, runs);
    } catch (Exception e) {
      log.error("Job Matcher worker failed: {}", e.getMessage(), e);
      throw new IllegalStateException("Worker execution failed", e);
    }
  }

  private List<AgentRunView> runEnrichment() {
    List<AgentRunView> runs = new ArrayList<>();
    for (MatchingProperties.Target target : matchingProperties.getTargets()) {
      AgentRunView run = enrichmentRunService.run(target.getTeamId(), target.getUserId(), RunTrigger.SCHEDULED)
          .block();
      if (run != null) {
        log.info("Enrichment run {} for user {}: {} {}", run.id(), run.userId(), run.status().getWireName(),
            run.outputs() != null ? run.outputs() : run.error());
        runs.add(run);
      }
    }
    return runs;
  }

  private void handleMetricsWait() {
    if (metricsWaitSeconds > 0) {
      log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
      try {
        Thread.sleep(metricsWaitSeconds * 1000L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        log.warn("Metrics wait interrupted");
      }
    }
  }
}
