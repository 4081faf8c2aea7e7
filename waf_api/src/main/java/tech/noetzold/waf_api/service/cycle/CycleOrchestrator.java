package tech.noetzold.waf_api.service.cycle;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tech.noetzold.waf_api.event.LiveEvent;
import tech.noetzold.waf_api.model.Hint;
import tech.noetzold.waf_api.model.Strategy;
import tech.noetzold.waf_api.service.ActivityLogService;
import tech.noetzold.waf_api.service.LiveEventService;
import tech.noetzold.waf_api.service.RuleStore;
import tech.noetzold.waf_api.service.StatsService;
import tech.noetzold.waf_api.service.adapt.AdaptAgent;
import tech.noetzold.waf_api.service.adapt.AdaptReport;
import tech.noetzold.waf_api.service.redteam.BypassResult;
import tech.noetzold.waf_api.service.redteam.RedTeamAgent;
import tech.noetzold.waf_api.service.redteam.RedTeamReport;
import tech.noetzold.waf_api.service.scout.ScoutAgent;
import tech.noetzold.waf_api.service.scout.ScoutReport;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one defense cycle: Scout, Red-Team, then up to {@code maxPatchRounds} rounds of Adapt with
 * a residual re-test between rounds. Background and manual cycles share one lock, so cycles never
 * overlap and the hint is only ever touched by the cycle holding it.
 */
@Slf4j
@Service
public class CycleOrchestrator {

    public static final String AGENT = "system";

    private final ScoutAgent scoutAgent;
    private final RedTeamAgent redTeamAgent;
    private final AdaptAgent adaptAgent;
    private final ActivityLogService activityLog;
    private final LiveEventService liveEvents;
    private final StatsService statsService;
    private final RuleStore ruleStore;
    private final ObjectMapper objectMapper;
    private final int maxPatchRounds;

    private final ReentrantLock lock = new ReentrantLock();
    private long lastCycleId = -1;
    private Hint hint;

    public CycleOrchestrator(ScoutAgent scoutAgent,
                             RedTeamAgent redTeamAgent,
                             AdaptAgent adaptAgent,
                             ActivityLogService activityLog,
                             LiveEventService liveEvents,
                             StatsService statsService,
                             RuleStore ruleStore,
                             ObjectMapper objectMapper,
                             @Value("${waf.cycle.max-patch-rounds:2}") int maxPatchRounds) {
        this.scoutAgent = scoutAgent;
        this.redTeamAgent = redTeamAgent;
        this.adaptAgent = adaptAgent;
        this.activityLog = activityLog;
        this.liveEvents = liveEvents;
        this.statsService = statsService;
        this.ruleStore = ruleStore;
        this.objectMapper = objectMapper;
        this.maxPatchRounds = maxPatchRounds;
    }

    /**
     * Blocks until any running cycle has finished, then runs a full one. A failure is recorded as a
     * {@code system/cycle_error} row and rethrown; the hint from the last good cycle is kept.
     */
    public CycleSummary runCycle() {
        lock.lock();
        try {
            long cycleId = nextCycleId();
            try {
                return cycle(cycleId);
            } catch (RuntimeException e) {
                log.error("Cycle #{} failed: {}", cycleId, e.getMessage(), e);
                try {
                    activityLog.record(AGENT, "cycle_error", "Cycle #" + cycleId + " failed: " + e.getMessage(), false);
                } catch (RuntimeException recordFailure) {
                    e.addSuppressed(recordFailure);
                }
                liveEvents.publish(LiveEvent.systemError("Cycle #" + cycleId + " failed: " + e.getMessage()));
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /** Hint the next cycle will hand to Scout, or {@code null}. */
    public Hint pendingHint() {
        lock.lock();
        try {
            return hint;
        } finally {
            lock.unlock();
        }
    }

    private CycleSummary cycle(long cycleId) {
        log.info("Cycle #{} starting{}", cycleId, hint == null ? "" : " with hint " + hint.dominantFailureMode());

        agentEvent(ScoutAgent.AGENT, "running", "Scanning for new techniques");
        ScoutReport scout = scoutAgent.run(hint);
        agentEvent(ScoutAgent.AGENT, "done", "Discovered " + scout.discovered() + " techniques");

        agentEvent(RedTeamAgent.AGENT, "running", "Testing techniques against the pipeline");
        RedTeamReport redTeam = redTeamAgent.run();
        agentEvent(RedTeamAgent.AGENT, "done", redTeam.bypassed() + " bypasses out of " + redTeam.tested());

        int rounds = 0;
        int patched = 0;
        int verified = 0;
        AdaptReport last = null;
        Set<Long> stillBypassing = Set.of();
        List<BypassResult> bypasses = redTeam.bypasses();

        if (bypasses.isEmpty()) {
            agentEvent(AdaptAgent.AGENT, "idle", "No bypasses this cycle");
        }
        while (!bypasses.isEmpty()) {
            agentEvent(AdaptAgent.AGENT, "running", "Patching " + bypasses.size() + " bypasses");
            last = adaptAgent.run(bypasses);
            rounds++;
            patched += last.patched();
            verified += last.verified();
            stillBypassing = last.stillBypassingIds();
            agentEvent(AdaptAgent.AGENT, "done", "Rules v" + last.newVersion() + ", " + stillBypassing.size() + " still bypassing");

            if (stillBypassing.isEmpty() || rounds >= maxPatchRounds) break;

            agentEvent(RedTeamAgent.AGENT, "running", "Re-testing " + stillBypassing.size() + " residual bypasses");
            RedTeamReport residual = redTeamAgent.runOn(stillBypassing);
            agentEvent(RedTeamAgent.AGENT, "done", residual.bypassed() + " residual bypasses");
            bypasses = residual.bypasses();
            if (bypasses.isEmpty()) {
                stillBypassing = Set.of();
            }
        }

        hint = last == null ? null : new Hint(last.dominantFailureMode(), last.weakCategories(), stillBypassing);

        CycleSummary summary = new CycleSummary(
                cycleId,
                scout.discovered(),
                redTeam.tested(),
                redTeam.blocked(),
                redTeam.bypassed(),
                patched,
                verified,
                rounds,
                scout.strategies().stream().map(Strategy::getWireName).toList(),
                ruleStore.current().getVersion(),
                last == null || last.dominantFailureMode() == null ? null : last.dominantFailureMode().getWireName(),
                stillBypassing.size());
        activityLog.record(AGENT, "cycle_summary", summary.detail(), true);
        liveEvents.publish(LiveEvent.stats(objectMapper.convertValue(statsService.current(),
                new TypeReference<Map<String, Object>>() {})));
        log.info(summary.detail());
        return summary;
    }

    private long nextCycleId() {
        if (lastCycleId < 0) {
            lastCycleId = activityLog.count(AGENT, "cycle_summary");
        }
        return ++lastCycleId;
    }

    private void agentEvent(String agent, String status, String detail) {
        liveEvents.publish(LiveEvent.agent(agent, status, detail));
    }
}
