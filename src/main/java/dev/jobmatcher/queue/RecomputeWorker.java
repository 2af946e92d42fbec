package dev.jobmatcher.queue;

import dev.jobmatcher.metrics.MatcherMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Claims queue items one at a time and hands them to the handler for their type.
 * Runs on the calling thread; handler work is awaited with a deadline.
 */
@Slf4j
@Service
public class RecomputeWorker {

    private final RecomputeQueueService queueService;
    private final Map<RecomputeItemType, RecomputeHandler> handlers = new EnumMap<>(RecomputeItemType.class);
    private final MatcherMetrics metrics;

    public RecomputeWorker(RecomputeQueueService queueService, List<RecomputeHandler> handlers,
            MatcherMetrics metrics) {
        this.queueService = queueService;
        this.metrics = metrics;
        for (RecomputeHandler handler : handlers) {
            if (this.handlers.put(handler.type(), handler) != null) {
                throw new IllegalStateException("Duplicate recompute handler for " + handler.type());
            }
        }
        log.info("Recompute worker ready with handlers for {}", this.handlers.keySet());
    }

    /**
     * Process up to {@code maxItems} claimed items.
     *
     * @param handlerTimeout how long a single handler may run before the attempt counts as failed
     */
    public DrainSummary drain(int maxItems, String workerId, Duration handlerTimeout) {
        int claimed = 0;
        int completed = 0;
        int failed = 0;
        int skipped = 0;

        while (claimed < maxItems) {
            Optional<RecomputeQueueItem> next = queueService.claimNext(workerId);
            if (next.isEmpty()) {
                break;
            }
            claimed++;
            RecomputeQueueItem item = next.get();

            if (queueService.isSuperseded(item)) {
                log.info("Skipping {} item {} for user {}: superseded by a newer version",
                        item.getItemType().getWireName(), item.getId(), item.getUserId());
                queueService.complete(item.getId());
                skipped++;
                continue;
            }

            try {
                process(item, handlerTimeout);
                queueService.complete(item.getId());
                completed++;
            } catch (RuntimeException e) {
                log.warn("{} item {} failed: {}", item.getItemType().getWireName(), item.getId(), e.getMessage());
                queueService.fail(item.getId(), describe(e));
                failed++;
            }
        }

        DrainSummary summary = new DrainSummary(claimed, completed, failed, skipped);
        log.info("Drain finished: {}", summary);
        return summary;
    }

    private void process(RecomputeQueueItem item, Duration handlerTimeout) {
        RecomputeHandler handler = handlers.get(item.getItemType());
        if (handler == null) {
            throw new IllegalStateException("No recompute handler registered for " + item.getItemType().getWireName());
        }
        long started = System.nanoTime();
        handler.handle(item).block(handlerTimeout);
        metrics.recordGenerationLatency("recompute_" + item.getItemType().getWireName(),
                Duration.ofNanos(System.nanoTime() - started));
    }

    private String describe(RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}
