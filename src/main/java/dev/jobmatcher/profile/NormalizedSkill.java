package dev.jobmatcher.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * @param level proficiency 1 (beginner) to 5 (expert)
 * @param years years of use, null when unknown
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NormalizedSkill(String canonicalName, String displayName, int level, Double years) {
}
