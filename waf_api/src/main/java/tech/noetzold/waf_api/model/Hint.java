package tech.noetzold.waf_api.model;

import java.util.Set;

/**
 * Feedback one cycle leaves for the next: what mostly went wrong, which categories stayed weak
 * and which techniques still got through after the last patch round.
 */
public record Hint(
        FailureMode dominantFailureMode,
        Set<AttackCategory> weakCategories,
        Set<Long> stillBypassingIds
) {

    public Hint {
        weakCategories = weakCategories == null ? Set.of() : Set.copyOf(weakCategories);
        stillBypassingIds = stillBypassingIds == null ? Set.of() : Set.copyOf(stillBypassingIds);
    }

    public boolean hasUnresolvedBypasses() {
        return !stillBypassingIds.isEmpty();
    }
}
