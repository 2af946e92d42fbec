package dev.jobmatcher.cache;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CachedSearchSpecRepository extends JpaRepository<CachedSearchSpec, String> {
}
