package tech.noetzold.waf_api.service.scout;

import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.Technique;

import java.util.List;

/**
 * Situational picture Scout hands the generator, computed from the catalog alone.
 *
 * @param weakCategories  up to five tested categories, lowest block rate first
 * @param unexplored      categories with fewer than three catalogued techniques, absent ones included
 * @param recentBypasses  up to five confirmed-unblocked techniques, most recently tested first
 * @param generation      number of prior Scout scans
 */
public record ReconBrief(
        List<CategoryStat> weakCategories,
        List<AttackCategory> unexplored,
        List<Technique> recentBypasses,
        long totalTechniques,
        long generation
) {

    public boolean hasRecentBypasses() {
        return !recentBypasses.isEmpty();
    }
}
