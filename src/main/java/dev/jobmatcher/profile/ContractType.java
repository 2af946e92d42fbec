package dev.jobmatcher.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Engagement types a search spec can target.
 */
public enum ContractType {
    FREELANCE("freelance"),
    CONTRACT("contract"),
    FULL_TIME("full_time"),
    PART_TIME("part_time");

    private final String wireName;

    ContractType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ContractType fromWire(String value) {
        for (ContractType item : values()) {
            if (item.wireName.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown contract type: " + value);
    }
}
