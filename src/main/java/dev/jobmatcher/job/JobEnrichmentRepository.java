package dev.jobmatcher.job;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JobEnrichmentRepository extends JpaRepository<JobEnrichment, Long> {

    boolean existsByJobIdAndEnrichmentVersion(String jobId, int enrichmentVersion);

    Optional<JobEnrichment> findByJobIdAndEnrichmentVersion(String jobId, int enrichmentVersion);
}
