package dev.jobmatcher.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NormalizedExperience(
        String title,
        String company,
        int durationMonths,
        @JsonProperty("is_current") boolean current,
        List<String> highlights) {

    public NormalizedExperience {
        highlights = highlights == null ? List.of() : List.copyOf(highlights);
    }
}
