package tech.noetzold.waf_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Diagnosed reason a bypass got through. Declaration order is the tie-break order
 * when picking the dominant mode of a batch.
 */
public enum FailureMode {
    PATTERN_GAP("pattern_gap"),
    ENCODING_EVASION("encoding_evasion"),
    CONTEXT_BLIND_SPOT("context_blind_spot"),
    SEMANTIC_MISS("semantic_miss"),
    CONFIDENCE_UNDERFLOW("confidence_underflow");

    private final String wireName;

    FailureMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
