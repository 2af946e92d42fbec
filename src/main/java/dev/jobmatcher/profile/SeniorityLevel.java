package dev.jobmatcher.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Seniority ladder used by profiles and search specs, ordered from least to most senior.
 */
public enum SeniorityLevel {
    ENTRY("entry"),
    JUNIOR("junior"),
    MID("mid"),
    SENIOR("senior"),
    LEAD("lead"),
    PRINCIPAL("principal");

    private final String wireName;

    SeniorityLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static SeniorityLevel fromWire(String value) {
        for (SeniorityLevel item : values()) {
            if (item.wireName.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown seniority level: " + value);
    }

    /**
     * Derives a level from total professional experience:
     * under 24 months entry, 24-47 junior, 48-71 mid, 72-119 senior, 120-179 lead, 180+ principal.
     */
    public static SeniorityLevel fromExperienceMonths(int months) {
        if (months < 24) {
            return ENTRY;
        } else if (months < 48) {
            return JUNIOR;
        } else if (months < 72) {
            return MID;
        } else if (months < 120) {
            return SENIOR;
        } else if (months < 180) {
            return LEAD;
        }
        return PRINCIPAL;
    }

    public SeniorityLevel above() {
        return this == PRINCIPAL ? this : values()[ordinal() + 1];
    }

    public SeniorityLevel below() {
        return this == ENTRY ? this : values()[ordinal() - 1];
    }
}
