package dev.jobmatcher.spec;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.jobmatcher.profile.ContractType;
import dev.jobmatcher.profile.RemotePreference;
import dev.jobmatcher.profile.SeniorityLevel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * The generated part of a search spec, before identity fields are attached.
 * Bounds are enforced by {@link SearchSpecValidator}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SearchSpecDraft(
        @NotNull @Size(min = 1, max = 10) List<@NotNull @Valid WeightedKeyword> titleKeywords,
        @NotNull @Size(min = 1, max = 20) List<@NotNull @Valid WeightedKeyword> skillKeywords,
        @NotNull @Size(max = 10) List<@NotBlank @Size(max = 100) String> negativeKeywords,
        @NotNull @Size(max = 5) List<@NotNull @Valid SearchLocation> locations,
        @NotNull @Size(max = 6) List<@NotNull SeniorityLevel> seniorityLevels,
        @NotNull RemotePreference remotePreference,
        @NotNull @Size(min = 1, max = 4) List<@NotNull ContractType> contractTypes,
        @PositiveOrZero Double hourlyMin,
        @PositiveOrZero Double hourlyMax,
        @PositiveOrZero Double fixedBudgetMin) {
}
