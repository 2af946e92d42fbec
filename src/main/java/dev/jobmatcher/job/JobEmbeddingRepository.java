package dev.jobmatcher.job;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface JobEmbeddingRepository extends JpaRepository<JobEmbedding, Long> {

    List<JobEmbedding> findByTeamIdAndModel(String teamId, String model);

    boolean existsByJobIdAndModel(String jobId, String model);
}
