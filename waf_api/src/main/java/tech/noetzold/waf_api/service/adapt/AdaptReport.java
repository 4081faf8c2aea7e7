package tech.noetzold.waf_api.service.adapt;

import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.FailureMode;
import tech.noetzold.waf_api.model.Hint;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one patch round.
 *
 * @param heuristic        true when the rules were carried forward unchanged
 * @param stillBypassingIds submitted bypasses the post-deploy check did not see blocked
 */
public record AdaptReport(
        int oldVersion,
        int newVersion,
        int patched,
        int verified,
        boolean heuristic,
        String analysis,
        List<String> newPatterns,
        FailureMode dominantFailureMode,
        Map<FailureMode, Integer> failureModes,
        Set<AttackCategory> weakCategories,
        Set<Long> stillBypassingIds
) {

    public AdaptReport {
        newPatterns = newPatterns == null ? List.of() : List.copyOf(newPatterns);
        failureModes = failureModes == null ? Map.of() : Map.copyOf(failureModes);
        weakCategories = weakCategories == null ? Set.of() : Set.copyOf(weakCategories);
        stillBypassingIds = stillBypassingIds == null ? Set.of() : Set.copyOf(stillBypassingIds);
    }

    public boolean hasStillBypassing() {
        return !stillBypassingIds.isEmpty();
    }

    public Hint toHint() {
        return new Hint(dominantFailureMode, weakCategories, stillBypassingIds);
    }
}
