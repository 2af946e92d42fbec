package dev.jobmatcher.queue;

import dev.jobmatcher.exception.IllegalQueueTransitionException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A unit of recomputation work.
 * <p>
 * Lifecycle: {@code pending -> processing -> completed | failed}, and
 * {@code failed -> pending} only while {@code retryCount < maxRetries}.
 * Every other move raises {@link IllegalQueueTransitionException}.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "recompute_queue", indexes = {
        @Index(name = "idx_recompute_queue_claim", columnList = "status,priority,createdAt"),
        @Index(name = "idx_recompute_queue_artifact", columnList = "userId,itemType,itemId,triggeredByVersion")
})
public class RecomputeQueueItem {

    public static final int HIGHEST_PRIORITY = 1;
    public static final int LOWEST_PRIORITY = 10;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String teamId;

    @Column(nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private RecomputeItemType itemType;

    @Column(length = 36)
    private String itemId;

    @Column(nullable = false)
    private int triggeredByVersion;

    @Column(nullable = false)
    private int priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RecomputeStatus status;

    @Column(length = 2000)
    private String error;

    @Column(nullable = false)
    private int retryCount;

    @Column(nullable = false)
    private int maxRetries;

    private String claimedBy;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant startedAt;
    private Instant completedAt;

    @Version
    private Long lockVersion;

    public void startProcessing(String workerId, Instant now) {
        requireStatus(RecomputeStatus.PENDING, RecomputeStatus.PROCESSING);
        status = RecomputeStatus.PROCESSING;
        claimedBy = workerId;
        startedAt = now;
    }

    public void complete(Instant now) {
        requireStatus(RecomputeStatus.PROCESSING, RecomputeStatus.COMPLETED);
        status = RecomputeStatus.COMPLETED;
        error = null;
        completedAt = now;
    }

    /**
     * Records a failed attempt. The retry budget is spent here, so a later {@link #requeue()}
     * only succeeds while attempts remain.
     */
    public void fail(String message, Instant now) {
        requireStatus(RecomputeStatus.PROCESSING, RecomputeStatus.FAILED);
        status = RecomputeStatus.FAILED;
        error = message;
        retryCount++;
        completedAt = now;
    }

    public boolean canRetry() {
        return status == RecomputeStatus.FAILED && retryCount < maxRetries;
    }

    public void requeue() {
        if (!canRetry()) {
            throw new IllegalQueueTransitionException(String.format(
                    "Queue item %d cannot be re-queued from %s (retries %d/%d)", id, status, retryCount, maxRetries));
        }
        status = RecomputeStatus.PENDING;
        claimedBy = null;
        startedAt = null;
        completedAt = null;
    }

    public boolean isTerminal() {
        return status == RecomputeStatus.COMPLETED || (status == RecomputeStatus.FAILED && !canRetry());
    }

    private void requireStatus(RecomputeStatus expected, RecomputeStatus target) {
        if (status != expected) {
            throw new IllegalQueueTransitionException(
                    String.format("Queue item %d cannot move from %s to %s", id, status, target));
        }
    }
}
