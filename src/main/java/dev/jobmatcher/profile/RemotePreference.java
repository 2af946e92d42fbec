package dev.jobmatcher.profile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RemotePreference {
    REMOTE_ONLY("remote_only"),
    HYBRID("hybrid"),
    ONSITE("onsite"),
    FLEXIBLE("flexible");

    private final String wireName;

    RemotePreference(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static RemotePreference fromWire(String value) {
        for (RemotePreference item : values()) {
            if (item.wireName.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown remote preference: " + value);
    }
}
