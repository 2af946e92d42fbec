package dev.jobmatcher.profile;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProfileEmbeddingRepository extends JpaRepository<ProfileEmbedding, Long> {

    Optional<ProfileEmbedding> findFirstByUserIdAndProfileVersionOrderByCreatedAtDesc(String userId,
            int profileVersion);

    List<ProfileEmbedding> findByUserIdAndProfileVersionLessThanOrderByProfileVersionAsc(String userId,
            int profileVersion, Pageable pageable);
}
