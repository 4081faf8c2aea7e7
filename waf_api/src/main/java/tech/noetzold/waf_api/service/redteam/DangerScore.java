package tech.noetzold.waf_api.service.redteam;

import tech.noetzold.waf_api.model.Severity;

/**
 * A severe technique the pipeline was unsure about ranks highest:
 * {@code weight(severity) * (1 + (1 - confidence))}.
 */
public final class DangerScore {

    private DangerScore() {
    }

    public static double of(Severity severity, double confidence) {
        Severity s = severity == null ? Severity.MEDIUM : severity;
        return s.getWeight() * (1.0 + (1.0 - confidence));
    }
}
