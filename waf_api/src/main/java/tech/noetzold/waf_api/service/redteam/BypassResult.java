package tech.noetzold.waf_api.service.redteam;

import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.model.FailureMode;
import tech.noetzold.waf_api.model.Severity;

/**
 * A technique the pipeline failed to block, joined with the verdict it got. The failure mode is
 * filled in later by Adapt's diagnosis.
 */
public record BypassResult(
        Long techniqueId,
        String techniqueName,
        AttackCategory category,
        Severity severity,
        String rawPayload,
        ClassificationVerdict verdict,
        double dangerScore,
        FailureMode failureMode
) {

    public static BypassResult from(AttackOutcome outcome) {
        ClassificationVerdict verdict = outcome.verdict();
        return new BypassResult(
                outcome.technique().getId(),
                outcome.technique().getTechniqueName(),
                outcome.technique().getCategory(),
                outcome.technique().getSeverity(),
                outcome.technique().getRawPayload(),
                verdict,
                DangerScore.of(outcome.technique().getSeverity(), verdict.getConfidence()),
                null);
    }

    public BypassResult withFailureMode(FailureMode mode) {
        return new BypassResult(techniqueId, techniqueName, category, severity, rawPayload, verdict, dangerScore, mode);
    }
}
