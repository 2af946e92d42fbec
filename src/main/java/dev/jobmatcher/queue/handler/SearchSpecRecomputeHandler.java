package dev.jobmatcher.queue.handler;

import dev.jobmatcher.profile.NormalizedProfileSource;
import dev.jobmatcher.queue.RecomputeItemType;
import dev.jobmatcher.queue.RecomputeQueueItem;
import dev.jobmatcher.spec.SearchSpecService;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class SearchSpecRecomputeHandler extends ProfileRecomputeHandler {

    private final SearchSpecService searchSpecService;

    public SearchSpecRecomputeHandler(NormalizedProfileSource profileSource, SearchSpecService searchSpecService) {
        super(profileSource);
        this.searchSpecService = searchSpecService;
    }

    @Override
    public RecomputeItemType type() {
        return RecomputeItemType.SEARCH_SPEC;
    }

    @Override
    public Mono<Void> handle(RecomputeQueueItem item) {
        return loadProfile(item)
                .flatMap(searchSpecService::getOrGenerate)
                .then();
    }
}
