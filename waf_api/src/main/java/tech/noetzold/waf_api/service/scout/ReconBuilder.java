package tech.noetzold.waf_api.service.scout;

import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.Technique;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Pure recon over a catalog snapshot. No I/O.
 */
final class ReconBuilder {

    static final int WEAK_CATEGORY_LIMIT = 5;
    static final int UNEXPLORED_THRESHOLD = 3;

    private ReconBuilder() {
    }

    static ReconBrief build(List<Technique> catalog, List<Technique> recentBypasses, long generation) {
        Map<AttackCategory, Long> totals = new EnumMap<>(AttackCategory.class);
        Map<AttackCategory, long[]> outcomes = new EnumMap<>(AttackCategory.class);

        for (Technique t : catalog) {
            AttackCategory category = t.getCategory() == null ? AttackCategory.ENCODING_EVASION : t.getCategory();
            totals.merge(category, 1L, Long::sum);
            if (t.getTestedAt() != null) {
                long[] counts = outcomes.computeIfAbsent(category, c -> new long[2]);
                counts[0]++;
                if (t.isBlocked()) counts[1]++;
            }
        }

        List<CategoryStat> weak = new ArrayList<>();
        outcomes.forEach((category, counts) -> weak.add(new CategoryStat(category, counts[0], counts[1])));
        // stable on enum order for equal rates
        weak.sort(Comparator.comparingDouble(CategoryStat::blockRate)
                .thenComparingInt(s -> s.category().ordinal()));

        List<AttackCategory> unexplored = new ArrayList<>();
        for (AttackCategory category : AttackCategory.values()) {
            if (totals.getOrDefault(category, 0L) < UNEXPLORED_THRESHOLD) {
                unexplored.add(category);
            }
        }

        return new ReconBrief(
                List.copyOf(weak.subList(0, Math.min(WEAK_CATEGORY_LIMIT, weak.size()))),
                List.copyOf(unexplored),
                List.copyOf(recentBypasses),
                catalog.size(),
                generation);
    }
}
