package tech.noetzold.waf_api.service.adapt;

import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.Classification;
import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.model.FailureMode;
import tech.noetzold.waf_api.service.redteam.BypassResult;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Assigns each bypass exactly one failure mode, first match wins:
 * confidence underflow, encoding evasion, context blind spot, semantic miss, pattern gap.
 * No state and no I/O.
 */
public final class FailureModeClassifier {

    static final double UNDERFLOW_CEILING = 0.6;

    static final Set<AttackCategory> DETECTABLE = EnumSet.of(
            AttackCategory.SQLI, AttackCategory.XSS, AttackCategory.COMMAND_INJECTION,
            AttackCategory.RCE, AttackCategory.SSRF);

    private static final List<Pattern> ENCODING_MARKERS = List.of(
            // layered percent-encoding
            Pattern.compile("(?i)%25[0-9a-f]{2}"),
            // null bytes
            Pattern.compile("%00|\\\\0|\\x00"),
            Pattern.compile("(?i)\\\\u[0-9a-f]{4}|%u[0-9a-f]{4}|\\\\x[0-9a-f]{2}"),
            // inline SQL comments, e.g. UN/**/ION
            Pattern.compile("/\\*.*?\\*/"),
            Pattern.compile("(?i)&#x?[0-9a-f]+;?|&(lt|gt|quot|apos|amp);")
    );

    private static final List<Pattern> CONTEXT_MARKERS = List.of(
            Pattern.compile("(?i)multipart/form-data"),
            Pattern.compile("(?i)content-type:\\s*(application|text)/([\\w.-]+\\+)?xml"),
            Pattern.compile("(?i)x-forwarded-for\\s*:"),
            Pattern.compile("(?i)graphql|\"query\"\\s*:\\s*\"\\s*(query|mutation|\\{)"),
            Pattern.compile("(?i)upgrade:\\s*websocket"),
            Pattern.compile("(?i)transfer-encoding:\\s*chunked")
    );

    private FailureModeClassifier() {
    }

    public static FailureMode diagnose(BypassResult bypass) {
        ClassificationVerdict verdict = bypass.verdict();
        Classification classification = verdict == null ? null : verdict.getClassification();
        String payload = bypass.rawPayload() == null ? "" : bypass.rawPayload();

        if (classification == Classification.MALICIOUS && verdict.getConfidence() <= UNDERFLOW_CEILING) {
            return FailureMode.CONFIDENCE_UNDERFLOW;
        }
        if (hasEncodingMarkers(payload)) {
            return FailureMode.ENCODING_EVASION;
        }
        if (classification == Classification.SAFE && hasContextMarkers(payload)) {
            return FailureMode.CONTEXT_BLIND_SPOT;
        }
        if (classification == Classification.SAFE && DETECTABLE.contains(bypass.category())) {
            return FailureMode.SEMANTIC_MISS;
        }
        return FailureMode.PATTERN_GAP;
    }

    public static List<BypassResult> diagnoseAll(Collection<BypassResult> bypasses) {
        return bypasses.stream().map(b -> b.withFailureMode(diagnose(b))).toList();
    }

    /** Counts per mode, in declaration order. Modes with no bypass are absent. */
    public static Map<FailureMode, Integer> countByMode(Collection<BypassResult> diagnosed) {
        Map<FailureMode, Integer> counts = new EnumMap<>(FailureMode.class);
        for (BypassResult b : diagnosed) {
            counts.merge(b.failureMode(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Largest group wins; on equal size the mode declared first wins.
     *
     * @return {@code null} for an empty batch
     */
    public static FailureMode dominant(Collection<BypassResult> diagnosed) {
        FailureMode best = null;
        int bestCount = 0;
        for (Map.Entry<FailureMode, Integer> e : countByMode(diagnosed).entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    static boolean hasEncodingMarkers(String payload) {
        return ENCODING_MARKERS.stream().anyMatch(p -> p.matcher(payload).find());
    }

    static boolean hasContextMarkers(String payload) {
        return CONTEXT_MARKERS.stream().anyMatch(p -> p.matcher(payload).find());
    }
}
