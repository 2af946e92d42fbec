package dev.jobmatcher.run;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AgentRunRepository extends JpaRepository<AgentRun, String> {

    Optional<AgentRun> findFirstByTeamIdAndAgentTypeOrderByCreatedAtDesc(String teamId, AgentType agentType);
}
