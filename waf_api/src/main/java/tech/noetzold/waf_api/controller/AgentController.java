package tech.noetzold.waf_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.waf_api.service.cycle.CycleOrchestrator;
import tech.noetzold.waf_api.service.cycle.CycleSummary;
import tech.noetzold.waf_api.service.redteam.RedTeamAgent;
import tech.noetzold.waf_api.service.redteam.RedTeamReport;
import tech.noetzold.waf_api.service.scout.ScoutAgent;
import tech.noetzold.waf_api.service.scout.ScoutReport;

/**
 * Manual triggers. Each call runs synchronously and returns the phase report.
 */
@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
@Tag(name = "Agents")
public class AgentController {

    private final ScoutAgent scoutAgent;
    private final RedTeamAgent redTeamAgent;
    private final CycleOrchestrator cycleOrchestrator;

    @PostMapping("/scout/run")
    public ScoutReport runScout() {
        return scoutAgent.run(null);
    }

    @PostMapping("/redteam/run")
    public RedTeamReport runRedTeam() {
        return redTeamAgent.run();
    }

    @PostMapping("/cycle")
    public CycleSummary runCycle() {
        return cycleOrchestrator.runCycle();
    }
}
