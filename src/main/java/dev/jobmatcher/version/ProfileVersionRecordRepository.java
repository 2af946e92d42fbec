package dev.jobmatcher.version;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProfileVersionRecordRepository extends JpaRepository<ProfileVersionRecord, Long> {

    Optional<ProfileVersionRecord> findByUserId(String userId);
}
