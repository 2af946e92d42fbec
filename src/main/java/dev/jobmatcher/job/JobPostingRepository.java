package dev.jobmatcher.job;

import dev.jobmatcher.profile.Platform;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JobPostingRepository extends JpaRepository<JobPosting, String> {

    Optional<JobPosting> findByTeamIdAndPlatformAndPlatformJobId(String teamId, Platform platform,
            String platformJobId);

    /**
     * Postings that have no enrichment for the given enrichment version, oldest first.
     */
    @Query("SELECT p FROM JobPosting p WHERE NOT EXISTS "
            + "(SELECT e.id FROM JobEnrichment e WHERE e.jobId = p.id AND e.enrichmentVersion = :version) "
            + "ORDER BY p.createdAt ASC")
    List<JobPosting> findPendingEnrichment(int version, Pageable pageable);

    /**
     * A team's postings that have no embedding under the given model, oldest first.
     */
    @Query("SELECT p FROM JobPosting p WHERE p.teamId = :teamId AND NOT EXISTS "
            + "(SELECT e.id FROM JobEmbedding e WHERE e.jobId = p.id AND e.model = :model) "
            + "ORDER BY p.createdAt ASC")
    List<JobPosting> findPendingEmbedding(String teamId, String model, Pageable pageable);

    List<JobPosting> findByTeamIdOrderByCreatedAtDesc(String teamId, Pageable pageable);
}
