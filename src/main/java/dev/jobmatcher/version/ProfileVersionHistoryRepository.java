package dev.jobmatcher.version;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProfileVersionHistoryRepository extends JpaRepository<ProfileVersionHistory, Long> {

    List<ProfileVersionHistory> findByUserIdOrderByToVersionAsc(String userId);
}
