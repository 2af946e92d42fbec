package dev.jobmatcher.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

/**
 * Canonical, derived view of a user's profile at one profile version.
 * Produced by the (external) normalization step; everything downstream reads this
 * instead of the raw profile.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NormalizedProfile(
        String userId,
        String teamId,
        int profileVersion,
        String displayName,
        String headline,
        String timezone,
        int totalExperienceMonths,
        SeniorityLevel inferredSeniority,
        List<NormalizedSkill> primarySkills,
        List<NormalizedSkill> secondarySkills,
        List<String> skillKeywords,
        List<NormalizedExperience> experiences,
        List<String> titleKeywords,
        NormalizedPreferences preferences,
        Instant normalizedAt) {

    public NormalizedProfile {
        primarySkills = primarySkills == null ? List.of() : List.copyOf(primarySkills);
        secondarySkills = secondarySkills == null ? List.of() : List.copyOf(secondarySkills);
        skillKeywords = skillKeywords == null ? List.of() : List.copyOf(skillKeywords);
        experiences = experiences == null ? List.of() : List.copyOf(experiences);
        titleKeywords = titleKeywords == null ? List.of() : List.copyOf(titleKeywords);
        if (inferredSeniority == null) {
            inferredSeniority = SeniorityLevel.fromExperienceMonths(totalExperienceMonths);
        }
        if (preferences == null) {
            preferences = new NormalizedPreferences(null, null, null, 0, null, null);
        }
    }
}
