package tech.noetzold.waf_api.service.classify;

import tech.noetzold.waf_api.model.Classification;

/**
 * Decoded engine reply: either a usable verdict or the reason it could not be read.
 */
public interface EngineOutcome {

    record ParsedVerdict(Classification classification, double confidence, String attackType, String reason)
            implements EngineOutcome {
    }

    record ParseFailure(String reason) implements EngineOutcome {
    }
}
