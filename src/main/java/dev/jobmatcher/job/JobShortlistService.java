package dev.jobmatcher.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.ai.VectorMath;
import dev.jobmatcher.config.MatchingProperties;
import dev.jobmatcher.profile.ProfileEmbedding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the team's postings closest to a profile embedding. Only embeddings produced by the
 * same model as the profile embedding are compared.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobShortlistService {

    private static final TypeReference<List<Double>> VECTOR_TYPE = new TypeReference<>() {
    };

    private final JobEmbeddingRepository embeddingRepository;
    private final MatchingProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Postings whose similarity is strictly above the configured threshold, most similar first,
     * at most the configured shortlist size.
     */
    public Mono<List<JobMatch>> shortlist(String teamId, ProfileEmbedding profileEmbedding) {
        return Mono.fromCallable(() -> {
                    List<Double> target = readVector(profileEmbedding.getVector());
                    List<JobMatch> matches = embeddingRepository.findByTeamIdAndModel(teamId,
                                    profileEmbedding.getModel()).stream()
                            .filter(embedding -> embedding.getDimensions() == target.size())
                            .map(embedding -> new JobMatch(embedding.getJobId(),
                                    VectorMath.cosineSimilarity(target, readVector(embedding.getVector()))))
                            .filter(match -> match.similarity() > properties.getSimilarityThreshold())
                            .sorted(Comparator.comparingDouble(JobMatch::similarity).reversed()
                                    .thenComparing(JobMatch::jobId))
                            .limit(properties.getShortlistSize())
                            .toList();
                    log.info("Shortlisted {} jobs for user {} (threshold {})", matches.size(),
                            profileEmbedding.getUserId(), properties.getSimilarityThreshold());
                    return matches;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private List<Double> readVector(String json) {
        try {
            return objectMapper.readValue(json, VECTOR_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored embedding vector is not a JSON array", e);
        }
    }
}
