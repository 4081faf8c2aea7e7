package tech.noetzold.waf_api.service.adapt;

import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.model.FailureMode;
import tech.noetzold.waf_api.service.redteam.BypassResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evidence handed to the rule generator, serialised as JSON.
 */
public record EvidenceReport(
        int total_bypasses,
        Map<String, Integer> failure_modes,
        String dominant_failure_mode,
        List<Item> bypasses
) {

    static final int PAYLOAD_LIMIT = 300;

    public record Item(
            String technique_name,
            String category,
            String severity,
            String failure_mode,
            double danger_score,
            String payload,
            ClassificationVerdict verdict
    ) {
    }

    /**
     * @param diagnosed bypasses with their failure mode set, most dangerous first
     */
    public static EvidenceReport of(List<BypassResult> diagnosed) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        FailureModeClassifier.countByMode(diagnosed).forEach((mode, n) -> counts.put(mode.getWireName(), n));
        FailureMode dominant = FailureModeClassifier.dominant(diagnosed);

        List<Item> items = diagnosed.stream()
                .map(b -> new Item(
                        b.techniqueName(),
                        b.category().getWireName(),
                        b.severity().getWireName(),
                        b.failureMode().getWireName(),
                        b.dangerScore(),
                        truncate(b.rawPayload()),
                        b.verdict()))
                .toList();
        return new EvidenceReport(diagnosed.size(), counts,
                dominant == null ? null : dominant.getWireName(), items);
    }

    private static String truncate(String payload) {
        if (payload == null) return "";
        return payload.length() <= PAYLOAD_LIMIT ? payload : payload.substring(0, PAYLOAD_LIMIT);
    }
}
