package tech.noetzold.waf_api.model;

import java.util.Locale;
import java.util.Optional;

public enum Classification {
    SAFE,
    SUSPICIOUS,
    MALICIOUS;

    public boolean isFlagged() {
        return this == SUSPICIOUS || this == MALICIOUS;
    }

    public static Optional<Classification> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
