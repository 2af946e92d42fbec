package dev.jobmatcher.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Contract type a user prefers. {@code any} widens to freelance and contract work.
 */
public enum ContractTypePreference {
    FREELANCE("freelance"),
    CONTRACT("contract"),
    FULL_TIME("full_time"),
    PART_TIME("part_time"),
    ANY("any");

    private final String wireName;

    ContractTypePreference(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ContractTypePreference fromWire(String value) {
        for (ContractTypePreference item : values()) {
            if (item.wireName.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown contract type preference: " + value);
    }

    public List<ContractType> toContractTypes() {
        return switch (this) {
            case FREELANCE -> List.of(ContractType.FREELANCE);
            case CONTRACT -> List.of(ContractType.CONTRACT);
            case FULL_TIME -> List.of(ContractType.FULL_TIME);
            case PART_TIME -> List.of(ContractType.PART_TIME);
            case ANY -> List.of(ContractType.FREELANCE, ContractType.CONTRACT);
        };
    }
}
