package tech.noetzold.waf_api.service.scout;

import tech.noetzold.waf_api.model.Hint;
import tech.noetzold.waf_api.model.Strategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the generation strategies for one Scout run. The first entry is the primary strategy.
 */
final class StrategySelector {

    private StrategySelector() {
    }

    static List<Strategy> select(ReconBrief recon, Hint hint) {
        Strategy[] rotation = Strategy.values();
        Strategy primary = rotation[(int) (recon.generation() % rotation.length)];

        List<Strategy> strategies = new ArrayList<>();
        strategies.add(primary);
        if (recon.hasRecentBypasses() && primary != Strategy.MUTATE_BYPASSES) {
            strategies.add(Strategy.MUTATE_BYPASSES);
        }
        return applyHint(strategies, hint);
    }

    /**
     * The counter-strategy for the dominant failure mode moves to the front; whatever the rotation
     * chose stays in the list behind it.
     */
    static List<Strategy> applyHint(List<Strategy> strategies, Hint hint) {
        List<Strategy> out = new ArrayList<>(strategies);
        if (hint == null) {
            return List.copyOf(out);
        }

        Strategy counter = Strategy.counterFor(hint.dominantFailureMode());
        if (counter != null) {
            out.remove(counter);
            out.add(0, counter);
        }
        if (hint.hasUnresolvedBypasses() && !out.contains(Strategy.MUTATE_BYPASSES)) {
            out.add(Strategy.MUTATE_BYPASSES);
        }
        return List.copyOf(out);
    }
}
