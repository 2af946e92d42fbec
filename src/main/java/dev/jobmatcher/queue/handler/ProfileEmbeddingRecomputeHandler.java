package dev.jobmatcher.queue.handler;

import dev.jobmatcher.profile.NormalizedProfileSource;
import dev.jobmatcher.profile.ProfileEmbeddingService;
import dev.jobmatcher.queue.RecomputeItemType;
import dev.jobmatcher.queue.RecomputeQueueItem;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class ProfileEmbeddingRecomputeHandler extends ProfileRecomputeHandler {

    private final ProfileEmbeddingService profileEmbeddingService;

    public ProfileEmbeddingRecomputeHandler(NormalizedProfileSource profileSource,
            ProfileEmbeddingService profileEmbeddingService) {
        super(profileSource);
        this.profileEmbeddingService = profileEmbeddingService;
    }

    @Override
    public RecomputeItemType type() {
        return RecomputeItemType.PROFILE_EMBEDDING;
    }

    @Override
    public Mono<Void> handle(RecomputeQueueItem item) {
        return loadProfile(item)
                .flatMap(profileEmbeddingService::embed)
                .then();
    }
}
