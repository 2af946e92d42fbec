package dev.jobmatcher.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Job search preferences carried on a normalized profile.
 *
 * @param tightness how strict ranking should be, 1 (loose) to 5 (strict)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NormalizedPreferences(
        List<Platform> platforms,
        RateRange hourlyRate,
        BudgetFloor fixedBudget,
        int tightness,
        RemotePreference remotePreference,
        ContractTypePreference contractType) {

    public static final int DEFAULT_TIGHTNESS = 3;

    public NormalizedPreferences {
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
        tightness = tightness == 0 ? DEFAULT_TIGHTNESS : tightness;
        remotePreference = remotePreference == null ? RemotePreference.FLEXIBLE : remotePreference;
        contractType = contractType == null ? ContractTypePreference.ANY : contractType;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RateRange(Double min, Double max, String currency) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BudgetFloor(Double min, String currency) {
    }
}
