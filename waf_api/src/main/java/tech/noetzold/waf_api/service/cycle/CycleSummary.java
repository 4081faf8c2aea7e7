package tech.noetzold.waf_api.service.cycle;

import java.util.List;

public record CycleSummary(
        long cycle_id,
        int discovered,
        int tested,
        int blocked,
        int bypasses,
        int patched,
        int verified,
        int patch_rounds,
        List<String> strategies_used,
        int rules_version,
        String dominant_failure_mode,
        int still_bypassing
) {

    String detail() {
        return String.format("Cycle #%d: discovered %d, tested %d, bypasses %d, patched %d (verified %d) in %d round%s, rules v%d, strategies %s",
                cycle_id, discovered, tested, bypasses, patched, verified, patch_rounds,
                patch_rounds == 1 ? "" : "s", rules_version, String.join("+", strategies_used));
    }
}
