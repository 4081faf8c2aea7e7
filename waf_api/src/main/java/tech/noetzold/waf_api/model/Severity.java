package tech.noetzold.waf_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW("low", 1),
    MEDIUM("medium", 2),
    HIGH("high", 3),
    CRITICAL("critical", 4);

    private final String wireName;
    private final int weight;

    Severity(String wireName, int weight) {
        this.wireName = wireName;
        this.weight = weight;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public int getWeight() {
        return weight;
    }

    @JsonCreator
    public static Severity coerce(String value) {
        if (value == null) return MEDIUM;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Severity s : values()) {
            if (s.wireName.equals(v)) return s;
        }
        return MEDIUM;
    }
}
