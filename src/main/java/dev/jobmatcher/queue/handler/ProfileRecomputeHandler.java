package dev.jobmatcher.queue.handler;

import dev.jobmatcher.profile.NormalizedProfile;
import dev.jobmatcher.profile.NormalizedProfileSource;
import dev.jobmatcher.queue.RecomputeHandler;
import dev.jobmatcher.queue.RecomputeQueueItem;
import dev.jobmatcher.version.StalenessOracle;
import dev.jobmatcher.version.StalenessVerdict;
import reactor.core.publisher.Mono;

/**
 * Base class for handlers that need the normalized profile the item was triggered for.
 */
public abstract class ProfileRecomputeHandler implements RecomputeHandler {

    protected final NormalizedProfileSource profileSource;

    protected ProfileRecomputeHandler(NormalizedProfileSource profileSource) {
        this.profileSource = profileSource;
    }

    /**
     * Loads the profile and fails when the source still serves a version older than the
     * one that triggered the item.
     */
    protected Mono<NormalizedProfile> loadProfile(RecomputeQueueItem item) {
        return profileSource.load(item.getTeamId(), item.getUserId())
                .map(profile -> requireVersion(profile, item));
    }

    protected NormalizedProfile requireVersion(NormalizedProfile profile, RecomputeQueueItem item) {
        StalenessVerdict verdict = StalenessOracle.checkStaleness(profile.profileVersion(),
                item.getTriggeredByVersion());
        if (verdict.stale()) {
            throw new IllegalStateException("Normalized profile for " + item.getUserId() + " is not ready: "
                    + verdict.reason());
        }
        return profile;
    }
}
