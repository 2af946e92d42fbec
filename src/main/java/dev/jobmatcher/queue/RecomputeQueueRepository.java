package dev.jobmatcher.queue;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface RecomputeQueueRepository extends JpaRepository<RecomputeQueueItem, Long> {

    Optional<RecomputeQueueItem> findFirstByUserIdAndItemTypeAndItemIdAndTriggeredByVersionAndStatus(
            String userId, RecomputeItemType itemType, String itemId, int triggeredByVersion, RecomputeStatus status);

    /**
     * Claim candidates: highest priority (lowest number) first, then oldest.
     */
    List<RecomputeQueueItem> findByStatusOrderByPriorityAscCreatedAtAscIdAsc(RecomputeStatus status,
            Pageable pageable);

    /**
     * Moves one item from pending to processing. Returns 1 for the single caller that wins
     * the race and 0 for everyone else.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE RecomputeQueueItem i SET i.status = :processing, i.claimedBy = :workerId, i.startedAt = :now, "
            + "i.lockVersion = i.lockVersion + 1 WHERE i.id = :id AND i.status = :pending")
    int claim(Long id, String workerId, Instant now, RecomputeStatus pending, RecomputeStatus processing);

    /**
     * Whether a newer item for the same artifact supersedes the given trigger version.
     */
    boolean existsByUserIdAndItemTypeAndItemIdAndTriggeredByVersionGreaterThanAndStatusNot(String userId,
            RecomputeItemType itemType, String itemId, int triggeredByVersion, RecomputeStatus status);

    long countByStatus(RecomputeStatus status);

    List<RecomputeQueueItem> findByUserIdOrderByCreatedAtAsc(String userId);
}
