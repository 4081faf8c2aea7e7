package tech.noetzold.waf_api.service.redteam;

import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.model.Technique;

/**
 * Result slot of one attack: either the verdict the endpoint returned or the error that prevented it.
 */
public record AttackOutcome(Technique technique, ClassificationVerdict verdict, String error) {

    public static AttackOutcome completed(Technique technique, ClassificationVerdict verdict) {
        return new AttackOutcome(technique, verdict, null);
    }

    public static AttackOutcome failed(Technique technique, String error) {
        return new AttackOutcome(technique, null, error == null ? "unknown error" : error);
    }

    public boolean isError() {
        return error != null;
    }

    public boolean isBypass() {
        return !isError() && !verdict.isBlocked();
    }
}
