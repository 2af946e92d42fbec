package dev.jobmatcher.queue.handler;

import dev.jobmatcher.profile.NormalizedProfileSource;
import dev.jobmatcher.queue.RecomputeItemType;
import dev.jobmatcher.queue.RecomputeQueueItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Slf4j
@Component
public class NormalizedProfileRecomputeHandler extends ProfileRecomputeHandler {

    public NormalizedProfileRecomputeHandler(NormalizedProfileSource profileSource) {
        super(profileSource);
    }

    @Override
    public RecomputeItemType type() {
        return RecomputeItemType.NORMALIZED_PROFILE;
    }

    @Override
    public Mono<Void> handle(RecomputeQueueItem item) {
        return profileSource.refresh(item.getTeamId(), item.getUserId())
                .map(profile -> requireVersion(profile, item))
                .doOnNext(profile -> log.info("Normalized profile for user {} refreshed at v{}",
                        profile.userId(), profile.profileVersion()))
                .then();
    }
}
