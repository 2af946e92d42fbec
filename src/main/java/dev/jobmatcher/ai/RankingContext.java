package dev.jobmatcher.ai;

import dev.jobmatcher.profile.NormalizedProfile;

/**
 * What a ranker knows about the candidate: the structured profile and its rendered text.
 */
public record RankingContext(NormalizedProfile profile, String userContext, int tightness) {
}
