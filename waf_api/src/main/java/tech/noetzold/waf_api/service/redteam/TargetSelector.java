package tech.noetzold.waf_api.service.redteam;

import tech.noetzold.waf_api.model.Technique;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Greedy budget allocation over priority tiers: a tier only gets what the earlier tiers left.
 */
final class TargetSelector {

    private TargetSelector() {
    }

    @SafeVarargs
    static List<Technique> select(int budget, List<Technique>... tiers) {
        List<Technique> targets = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (List<Technique> tier : tiers) {
            for (Technique t : tier) {
                if (targets.size() >= budget) {
                    return targets;
                }
                if (seen.add(t.getId())) {
                    targets.add(t);
                }
            }
        }
        return targets;
    }
}
