package dev.jobmatcher.version;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of versioned artifacts that can be queried for staleness.
 */
public enum ArtifactType {
    SEARCH_SPEC("search_spec"),
    EMBEDDING("embedding"),
    SCORE("score");

    private final String wireName;

    ArtifactType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ArtifactType fromWire(String value) {
        for (ArtifactType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown artifact type: " + value);
    }
}
