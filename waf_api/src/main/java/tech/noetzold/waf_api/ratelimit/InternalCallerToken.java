package tech.noetzold.waf_api.ratelimit;

import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Per-process secret that marks requests fired by the service at itself
 * (Red-Team attacks and Adapt verification).
 */
@Component
public class InternalCallerToken {

    public static final String HEADER = "X-Waf-Internal";

    private final String value = UUID.randomUUID().toString();

    public String value() {
        return value;
    }

    public boolean matches(String candidate) {
        if (candidate == null) return false;
        return MessageDigest.isEqual(value.getBytes(StandardCharsets.UTF_8),
                candidate.getBytes(StandardCharsets.UTF_8));
    }
}
