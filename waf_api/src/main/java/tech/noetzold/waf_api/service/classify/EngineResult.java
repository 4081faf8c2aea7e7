package tech.noetzold.waf_api.service.classify;

import tech.noetzold.waf_api.model.Classification;

/**
 * Verdict from an external engine. {@code degraded} marks the conservative stand-in
 * produced when the engine failed or answered with something unusable.
 */
public record EngineResult(
        Classification classification,
        double confidence,
        String attackType,
        String reason,
        String classifier,
        double responseTimeMs,
        boolean degraded
) implements StageVerdict {

    static final double DEGRADED_CONFIDENCE = 0.5;

    public static EngineResult degraded(String classifier, String reason, double responseTimeMs) {
        return new EngineResult(Classification.SUSPICIOUS, DEGRADED_CONFIDENCE, "none", reason,
                classifier, responseTimeMs, true);
    }
}
