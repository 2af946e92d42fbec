package dev.jobmatcher.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Platform {
    UPWORK("upwork"),
    LINKEDIN("linkedin");

    private final String wireName;

    Platform(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static Platform fromWire(String value) {
        for (Platform item : values()) {
            if (item.wireName.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + value);
    }
}
