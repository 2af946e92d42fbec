package dev.jobmatcher.profile;

import reactor.core.publisher.Mono;

/**
 * Supplies normalized profiles. Normalization itself happens elsewhere; this is the
 * read side the pipeline depends on.
 */
public interface NormalizedProfileSource {

    /**
     * Loads the current normalized profile of a user.
     * Errors with {@link dev.jobmatcher.exception.EntityNotFoundException} when unknown.
     */
    Mono<NormalizedProfile> load(String teamId, String userId);

    /**
     * Asks the source to rebuild the normalized profile from the raw profile and returns
     * the result. Sources without a normalization step simply reload.
     */
    default Mono<NormalizedProfile> refresh(String teamId, String userId) {
        return load(teamId, userId);
    }
}
