package tech.noetzold.waf_api.service.redteam;

import tech.noetzold.waf_api.model.AttackCategory;

import java.util.List;
import java.util.Map;

/**
 * @param bypasses confirmed bypasses, most dangerous first
 */
public record RedTeamReport(
        int tested,
        int blocked,
        int bypassed,
        int errors,
        Map<AttackCategory, CategoryBreakdown> categoryBreakdown,
        List<BypassResult> bypasses
) {

    public static RedTeamReport empty() {
        return new RedTeamReport(0, 0, 0, 0, Map.of(), List.of());
    }
}
