package dev.jobmatcher.version;

import dev.jobmatcher.job.JobScoreRepository;
import dev.jobmatcher.profile.ProfileEmbeddingRepository;
import dev.jobmatcher.spec.SearchSpecRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Finds stored artifacts computed from an older profile version.
 */
@Service
@RequiredArgsConstructor
public class StaleArtifactService {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    private final SearchSpecRecordRepository searchSpecRecordRepository;
    private final ProfileEmbeddingRepository profileEmbeddingRepository;
    private final JobScoreRepository jobScoreRepository;

    public List<StaleItem> findStale(String userId, int currentVersion, ArtifactType type) {
        return findStale(userId, currentVersion, type, DEFAULT_LIMIT);
    }

    /**
     * Oldest versions first, each annotated with how far behind it is.
     */
    @Transactional(readOnly = true)
    public List<StaleItem> findStale(String userId, int currentVersion, ArtifactType type, int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIMIT + " but was " + limit);
        }
        Pageable page = PageRequest.of(0, limit);
        return switch (type) {
            case SEARCH_SPEC -> searchSpecRecordRepository
                    .findByUserIdAndProfileVersionLessThanOrderByProfileVersionAsc(userId, currentVersion, page)
                    .stream()
                    .map(r -> toStaleItem(String.valueOf(r.getId()), r, currentVersion))
                    .toList();
            case EMBEDDING -> profileEmbeddingRepository
                    .findByUserIdAndProfileVersionLessThanOrderByProfileVersionAsc(userId, currentVersion, page)
                    .stream()
                    .map(e -> toStaleItem(String.valueOf(e.getId()), e, currentVersion))
                    .toList();
            case SCORE -> jobScoreRepository
                    .findByUserIdAndProfileVersionLessThanOrderByProfileVersionAsc(userId, currentVersion, page)
                    .stream()
                    .map(s -> toStaleItem(String.valueOf(s.getId()), s, currentVersion))
                    .toList();
        };
    }

    private StaleItem toStaleItem(String id, VersionedArtifact artifact, int currentVersion) {
        StalenessVerdict verdict = StalenessOracle.checkStaleness(artifact, currentVersion);
        return new StaleItem(id, artifact.getProfileVersion(), verdict.versionGap(), artifact.getCreatedAt());
    }
}
