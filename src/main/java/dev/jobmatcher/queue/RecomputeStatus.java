package dev.jobmatcher.queue;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecomputeStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }
}
