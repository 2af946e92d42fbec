package dev.jobmatcher.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the matching pipeline.
 */
@Component
public class MatcherMetrics {

    private static final String TAG_OPERATION = "operation";
    private static final String TAG_STATUS = "status";
    private final MeterRegistry registry;

    // Cache
    private final Counter cacheHitsCounter;
    private final Counter cacheMissesCounter;

    // Queue
    private final Counter queueEnqueuedCounter;
    private final Counter queueClaimedCounter;
    private final Counter queueCompletedCounter;
    private final Counter queueFailedCounter;

    // Timers (per generation operation)
    private final ConcurrentHashMap<String, Timer> generationTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastDrainProcessed = new AtomicInteger(0);
    private final AtomicInteger lastDrainFailed = new AtomicInteger(0);
    private final AtomicInteger lastRunEnriched = new AtomicInteger(0);

    public MatcherMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.cacheHitsCounter = Counter.builder("job_matcher_search_spec_cache_hits_total")
                .description("Search spec cache lookups served from cache")
                .register(registry);

        this.cacheMissesCounter = Counter.builder("job_matcher_search_spec_cache_misses_total")
                .description("Search spec cache lookups that required generation")
                .register(registry);

        this.queueEnqueuedCounter = Counter.builder("job_matcher_recompute_enqueued_total")
                .description("Recompute items inserted (coalesced requests excluded)")
                .register(registry);

        this.queueClaimedCounter = Counter.builder("job_matcher_recompute_claimed_total")
                .description("Recompute items claimed by a worker")
                .register(registry);

        this.queueCompletedCounter = Counter.builder("job_matcher_recompute_completed_total")
                .description("Recompute items completed")
                .register(registry);

        this.queueFailedCounter = Counter.builder("job_matcher_recompute_failed_total")
                .description("Recompute item attempts that failed")
                .register(registry);

        Gauge.builder("job_matcher_last_drain_processed", lastDrainProcessed, AtomicInteger::get)
                .description("Queue items processed in last worker run")
                .register(registry);

        Gauge.builder("job_matcher_last_drain_failed", lastDrainFailed, AtomicInteger::get)
                .description("Queue items failed in last worker run")
                .register(registry);

        Gauge.builder("job_matcher_last_run_jobs_enriched", lastRunEnriched, AtomicInteger::get)
                .description("Job postings enriched in last worker run")
                .register(registry);
    }

    public void recordCacheHit() {
        cacheHitsCounter.increment();
    }

    public void recordCacheMiss() {
        cacheMissesCounter.increment();
    }

    /**
     * Record a generation output that failed validation.
     */
    public void recordGenerationFailure(String operation) {
        Counter.builder("job_matcher_generation_failures_total")
                .tag(TAG_OPERATION, operation)
                .register(registry)
                .increment();
    }

    /**
     * Record a batch whose returned ids did not match the ids sent.
     */
    public void recordBatchIdentityMismatch(String operation) {
        Counter.builder("job_matcher_batch_identity_mismatches_total")
                .tag(TAG_OPERATION, operation)
                .register(registry)
                .increment();
    }

    /**
     * Record entries dropped from a best-effort batch.
     */
    public void recordRejectedEntries(String operation, int count) {
        Counter.builder("job_matcher_batch_rejected_entries_total")
                .tag(TAG_OPERATION, operation)
                .register(registry)
                .increment(count);
    }

    /**
     * Get or create a timer for a generation operation.
     */
    public Timer getGenerationTimer(String operation) {
        return generationTimers.computeIfAbsent(operation, name ->
                Timer.builder("job_matcher_generation_duration")
                        .description("Time spent in one generation call")
                        .tag(TAG_OPERATION, name)
                        .register(registry));
    }

    public void recordGenerationLatency(String operation, Duration duration) {
        getGenerationTimer(operation).record(duration);
    }

    public void recordEnqueued() {
        queueEnqueuedCounter.increment();
    }

    public void recordClaimed() {
        queueClaimedCounter.increment();
    }

    public void recordCompleted() {
        queueCompletedCounter.increment();
    }

    public void recordFailed() {
        queueFailedCounter.increment();
    }

    public void recordRunStarted(String agentType) {
        Counter.builder("job_matcher_runs_started_total")
                .tag("agent_type", agentType)
                .register(registry)
                .increment();
    }

    public void recordRunFinished(String agentType, String status) {
        Counter.builder("job_matcher_runs_finished_total")
                .tag("agent_type", agentType)
                .tag(TAG_STATUS, status)
                .register(registry)
                .increment();
    }

    /**
     * Update last worker run statistics.
     */
    public void updateLastRunStats(int processed, int failed, int enriched) {
        lastDrainProcessed.set(processed);
        lastDrainFailed.set(failed);
        lastRunEnriched.set(enriched);
    }
}
