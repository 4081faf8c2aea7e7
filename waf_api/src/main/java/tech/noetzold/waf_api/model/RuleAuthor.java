package tech.noetzold.waf_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RuleAuthor {
    SYSTEM("system"),
    SCOUT("scout"),
    ADAPT("adapt"),
    HEURISTIC("heuristic");

    private final String wireName;

    RuleAuthor(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static RuleAuthor fromWire(String value) {
        if (value == null) return SYSTEM;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (RuleAuthor a : values()) {
            if (a.wireName.equals(v)) return a;
        }
        return SYSTEM;
    }
}
