package tech.noetzold.waf_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum AttackCategory {
    SQLI("sqli", "SQL injection"),
    XSS("xss", "Cross-site scripting"),
    PATH_TRAVERSAL("path_traversal", "Path traversal"),
    COMMAND_INJECTION("command_injection", "Command injection"),
    SSRF("ssrf", "Server-side request forgery"),
    RCE("rce", "Remote code execution"),
    HEADER_INJECTION("header_injection", "Header injection"),
    XXE("xxe", "XML external entity injection"),
    AUTH_BYPASS("auth_bypass", "Authentication bypass"),
    ENCODING_EVASION("encoding_evasion", "Encoding evasion");

    private final String wireName;
    private final String displayName;

    AttackCategory(String wireName, String displayName) {
        this.wireName = wireName;
        this.displayName = displayName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<AttackCategory> fromWire(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (AttackCategory c : values()) {
            if (c.wireName.equals(v)) return Optional.of(c);
        }
        return Optional.empty();
    }

    /** Unknown values degrade to {@link #ENCODING_EVASION}, never rejected. */
    @JsonCreator
    public static AttackCategory coerce(String value) {
        return fromWire(value).orElse(ENCODING_EVASION);
    }
}
