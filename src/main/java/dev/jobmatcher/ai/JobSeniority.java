package dev.jobmatcher.ai;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Seniority a posting asks for, as judged during enrichment.
 */
public enum JobSeniority {
    JUNIOR("junior"),
    MID("mid"),
    SENIOR("senior");

    private final String wireName;

    JobSeniority(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static JobSeniority fromWire(String value) {
        for (JobSeniority item : values()) {
            if (item.wireName.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown job seniority: " + value);
    }

    /**
     * 0-2 years junior, 3-5 mid, 6 or more senior.
     */
    public static JobSeniority fromYears(int years) {
        if (years <= 2) {
            return JUNIOR;
        }
        return years <= 5 ? MID : SENIOR;
    }
}
