package dev.jobmatcher.run;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunTrigger {

    MANUAL("manual"),
    SCHEDULED("scheduled");

    private final String wireName;

    RunTrigger(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
