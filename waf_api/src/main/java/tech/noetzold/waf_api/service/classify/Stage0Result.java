package tech.noetzold.waf_api.service.classify;

import tech.noetzold.waf_api.model.Classification;

/**
 * Local pattern matcher verdict. {@code hits} is the number of patterns matched
 * in the winning category, zero for a clean request.
 */
public record Stage0Result(
        Classification classification,
        double confidence,
        String attackType,
        String reason,
        double responseTimeMs,
        int hits
) implements StageVerdict {

    public static final String CLASSIFIER = "regex";

    @Override
    public String classifier() {
        return CLASSIFIER;
    }
}
