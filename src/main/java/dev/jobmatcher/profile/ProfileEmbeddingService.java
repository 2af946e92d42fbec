package dev.jobmatcher.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobmatcher.ai.EmbeddingClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;

/**
 * Embeds the rendered profile context and stores it stamped with the profile version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileEmbeddingService {

    private final EmbeddingClient embeddingClient;
    private final UserContextBuilder userContextBuilder;
    private final ProfileEmbeddingRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Mono<ProfileEmbedding> embed(NormalizedProfile profile) {
        String context = userContextBuilder.build(profile);
        return embeddingClient.embed(context)
                .flatMap(vector -> Mono.fromCallable(() -> repository.save(ProfileEmbedding.builder()
                                .teamId(profile.teamId())
                                .userId(profile.userId())
                                .profileVersion(profile.profileVersion())
                                .model(embeddingClient.modelName())
                                .dimensions(vector.size())
                                .vector(writeVector(vector))
                                .createdAt(clock.instant())
                                .build()))
                        .subscribeOn(Schedulers.boundedElastic()))
                .doOnNext(saved -> log.info("Stored {}-dim profile embedding for user {} v{}",
                        saved.getDimensions(), saved.getUserId(), saved.getProfileVersion()));
    }

    private String writeVector(List<Double> vector) {
        try {
            return objectMapper.writeValueAsString(vector);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize embedding vector", e);
        }
    }
}
