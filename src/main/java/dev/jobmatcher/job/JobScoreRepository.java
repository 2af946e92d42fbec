package dev.jobmatcher.job;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JobScoreRepository extends JpaRepository<JobScore, Long> {

    List<JobScore> findByUserIdAndProfileVersionAndTightnessOrderByCreatedAtDescIdDesc(String userId,
            int profileVersion, int tightness);

    List<JobScore> findByUserIdAndProfileVersionLessThanOrderByProfileVersionAsc(String userId, int profileVersion,
            Pageable pageable);

    /**
     * Jobs scored for the user at an older version and not yet at {@code currentVersion} or later.
     */
    @Query("SELECT DISTINCT s.jobId FROM JobScore s WHERE s.userId = :userId AND s.profileVersion < :currentVersion "
            + "AND s.jobId NOT IN (SELECT t.jobId FROM JobScore t WHERE t.userId = :userId "
            + "AND t.profileVersion >= :currentVersion)")
    List<String> findJobIdsWithStaleScores(String userId, int currentVersion, Pageable pageable);

    List<JobScore> findByJobIdAndUserIdOrderByCreatedAtDesc(String jobId, String userId);
}
