package tech.noetzold.waf_api.service.redteam;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import tech.noetzold.waf_api.client.ClassifyEndpointClient;
import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.model.Technique;
import tech.noetzold.waf_api.service.ActivityLogService;
import tech.noetzold.waf_api.service.TechniqueStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Adversarial testing phase. Picks targets under a budget, fires them at the live classify
 * endpoint with bounded concurrency and ranks what got through.
 */
@Slf4j
@Service
public class RedTeamAgent {

    public static final String AGENT = "redteam";

    static final int DETAIL_LIMIT = 500;

    private final TechniqueStore techniqueStore;
    private final ClassifyEndpointClient classifyClient;
    private final ActivityLogService activityLog;
    private final TaskExecutor executor;
    private final int budget;
    private final int patchedSample;

    public RedTeamAgent(TechniqueStore techniqueStore,
                        ClassifyEndpointClient classifyClient,
                        ActivityLogService activityLog,
                        @Qualifier("redTeamExecutor") TaskExecutor executor,
                        @Value("${waf.redteam.budget:15}") int budget,
                        @Value("${waf.redteam.patched-sample:5}") int patchedSample) {
        this.techniqueStore = techniqueStore;
        this.classifyClient = classifyClient;
        this.activityLog = activityLog;
        this.executor = executor;
        this.budget = budget;
        this.patchedSample = patchedSample;
    }

    /**
     * Tier order: never tested (newest first), confirmed bypasses (oldest test first), then a small
     * sample of patched-and-blocked techniques to check the patch still holds.
     */
    public RedTeamReport run() {
        List<Technique> targets = TargetSelector.select(budget,
                techniqueStore.neverTested(),
                techniqueStore.confirmedBypasses(),
                techniqueStore.recentlyPatched(patchedSample));
        return attack(targets);
    }

    /** Re-test of an explicit id set, used for residual bypasses between patch rounds. */
    public RedTeamReport runOn(Collection<Long> techniqueIds) {
        return attack(techniqueStore.findAllById(techniqueIds));
    }

    private RedTeamReport attack(List<Technique> targets) {
        if (targets.isEmpty()) {
            activityLog.record(AGENT, "red_team", "No techniques to test this cycle", true);
            return RedTeamReport.empty();
        }

        log.info("Red-Team firing {} techniques", targets.size());
        List<CompletableFuture<AttackOutcome>> futures = targets.stream()
                .map(t -> CompletableFuture.supplyAsync(() -> attackSingle(t), executor))
                .toList();
        List<AttackOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<AttackOutcome> future : futures) {
            try {
                outcomes.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
        }

        RedTeamReport report = summarise(outcomes);
        activityLog.record(AGENT, "red_team", detail(report), true);
        for (AttackOutcome outcome : outcomes) {
            if (outcome.isError()) {
                activityLog.record(AGENT, "error",
                        "Failed to test " + outcome.technique().getTechniqueName() + ": " + outcome.error(), false);
            }
        }
        log.info("Red-Team tested {}: {} blocked, {} bypasses, {} errors",
                report.tested(), report.blocked(), report.bypassed(), report.errors());
        return report;
    }

    /**
     * Only a completed call updates the technique row. Transport failures stay local to this slot;
     * persistence failures propagate.
     */
    AttackOutcome attackSingle(Technique technique) {
        ClassificationVerdict verdict;
        try {
            verdict = classifyClient.classify(technique.getRawPayload());
        } catch (RuntimeException e) {
            log.warn("Attack on '{}' failed: {}", technique.getTechniqueName(), e.getMessage());
            return AttackOutcome.failed(technique, e.getMessage());
        }
        techniqueStore.recordTestOutcome(technique.getId(), verdict.isBlocked());
        return AttackOutcome.completed(technique, verdict);
    }

    static RedTeamReport summarise(List<AttackOutcome> outcomes) {
        Map<AttackCategory, CategoryBreakdown> breakdown = new EnumMap<>(AttackCategory.class);
        List<BypassResult> bypasses = new ArrayList<>();
        int blocked = 0;
        int errors = 0;

        for (AttackOutcome outcome : outcomes) {
            breakdown.merge(outcome.technique().getCategory(), CategoryBreakdown.EMPTY.add(outcome),
                    (a, b) -> a.add(outcome));
            if (outcome.isError()) {
                errors++;
            } else if (outcome.isBypass()) {
                bypasses.add(BypassResult.from(outcome));
            } else {
                blocked++;
            }
        }

        bypasses.sort(Comparator.comparingDouble(BypassResult::dangerScore).reversed());
        return new RedTeamReport(outcomes.size(), blocked, bypasses.size(), errors,
                Collections.unmodifiableMap(breakdown), List.copyOf(bypasses));
    }

    static String detail(RedTeamReport report) {
        String categories = report.categoryBreakdown().isEmpty()
                ? "no categories tested"
                : report.categoryBreakdown().entrySet().stream()
                .map(e -> e.getValue().bypassed() > 0
                        ? e.getKey().getWireName() + ": " + e.getValue().bypassed() + "/" + e.getValue().tested() + " bypassed"
                        : e.getKey().getWireName() + ": " + e.getValue().blocked() + "/" + e.getValue().tested() + " blocked")
                .collect(Collectors.joining("; "));
        String detail = "Tested " + report.tested() + " techniques: " + report.blocked() + " blocked, "
                + report.bypassed() + " bypasses, " + report.errors() + " errors. [" + categories + "]";
        if (detail.length() > DETAIL_LIMIT) {
            detail = detail.substring(0, DETAIL_LIMIT - 3) + "...";
        }
        return detail;
    }
}
