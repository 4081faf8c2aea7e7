package tech.noetzold.waf_api.service.classify;

import tech.noetzold.waf_api.model.Classification;

/**
 * What every pipeline stage reports, whichever stage produced it.
 */
public interface StageVerdict {

    Classification classification();

    double confidence();

    String attackType();

    String reason();

    String classifier();

    double responseTimeMs();
}
