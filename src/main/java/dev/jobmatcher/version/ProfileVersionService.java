package dev.jobmatcher.version;

import dev.jobmatcher.exception.EntityNotFoundException;
import dev.jobmatcher.exception.JobMatcherException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Single write path for profile versions.
 *
 * <p>Every write is validated against {@link ProfileVersions}, recorded in the history and
 * followed by a staleness sweep. Concurrent writers for the same user are detected through
 * the optimistic lock on {@link ProfileVersionRecord}; the loser gets Spring's
 * {@code ObjectOptimisticLockingFailureException} and is expected to retry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileVersionService {

    private final ProfileVersionRecordRepository recordRepository;
    private final ProfileVersionHistoryRepository historyRepository;
    private final StalenessSweepService stalenessSweepService;
    private final Clock clock;

    /**
     * Creates the ledger row at the minimum version. Returns the existing row when present.
     */
    @Transactional
    public ProfileVersionRecord initialize(String teamId, String userId) {
        return recordRepository.findByUserId(userId).orElseGet(() -> {
            log.info("Initializing profile version ledger for user {} at v{}", userId,
                    ProfileVersions.MIN_PROFILE_VERSION);
            return recordRepository.save(ProfileVersionRecord.builder()
                    .teamId(teamId)
                    .userId(userId)
                    .currentVersion(ProfileVersions.MIN_PROFILE_VERSION)
                    .updatedAt(clock.instant())
                    .build());
        });
    }

    @Transactional(readOnly = true)
    public int currentVersion(String userId) {
        return load(userId).getCurrentVersion();
    }

    /**
     * Moves the user to the next version.
     */
    @Transactional
    public VersionBump bump(String teamId, String userId, ProfileChangeType changeType, Map<String, Object> details) {
        ProfileVersionRecord record = load(userId);
        return advance(record, teamId, ProfileVersions.nextVersion(record.getCurrentVersion()), changeType, details);
    }

    /**
     * Writes an explicit version proposed by a caller. Anything other than the current
     * version plus one is rejected.
     */
    @Transactional
    public VersionBump advanceTo(String teamId, String userId, int proposedVersion, ProfileChangeType changeType,
            Map<String, Object> details) {
        return advance(load(userId), teamId, proposedVersion, changeType, details);
    }

    @Transactional(readOnly = true)
    public List<ProfileVersionHistory> history(String userId) {
        return historyRepository.findByUserIdOrderByToVersionAsc(userId);
    }

    private VersionBump advance(ProfileVersionRecord record, String teamId, int newVersion,
            ProfileChangeType changeType, Map<String, Object> details) {
        int oldVersion = record.getCurrentVersion();
        try {
            ProfileVersions.validateTransition(oldVersion, newVersion);
        } catch (JobMatcherException e) {
            log.error("[{}] Rejected version write for user {}: {}", e.getErrorCode(), record.getUserId(),
                    e.getMessage());
            throw e;
        }

        Instant now = clock.instant();
        record.setCurrentVersion(newVersion);
        record.setUpdatedAt(now);
        recordRepository.saveAndFlush(record);

        historyRepository.save(ProfileVersionHistory.builder()
                .teamId(teamId)
                .userId(record.getUserId())
                .fromVersion(oldVersion)
                .toVersion(newVersion)
                .changeType(changeType)
                .changeDetails(details)
                .changedAt(now)
                .build());
        log.info("Profile of user {} moved v{} -> v{} ({})", record.getUserId(), oldVersion, newVersion,
                changeType.getWireName());

        int enqueued = stalenessSweepService.enqueueRecompute(teamId, record.getUserId(), newVersion);
        return new VersionBump(record.getUserId(), oldVersion, newVersion, changeType, enqueued);
    }

    private ProfileVersionRecord load(String userId) {
        return recordRepository.findByUserId(userId)
                .orElseThrow(() -> new EntityNotFoundException("Profile version", userId));
    }
}
