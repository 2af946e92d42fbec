package dev.jobmatcher.run;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentType {

    JOB_SEARCH("job_search"),
    JOB_ENRICHMENT("job_enrichment");

    private final String wireName;

    AgentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static AgentType fromWire(String value) {
        for (AgentType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown agent type: " + value);
    }
}
