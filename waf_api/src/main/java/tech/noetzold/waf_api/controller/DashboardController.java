package tech.noetzold.waf_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.waf_api.event.LiveEvent;
import tech.noetzold.waf_api.model.AgentLogEntry;
import tech.noetzold.waf_api.model.RequestLogEntry;
import tech.noetzold.waf_api.model.RuleVersionResponse;
import tech.noetzold.waf_api.model.StatsResponse;
import tech.noetzold.waf_api.model.ThreatResponse;
import tech.noetzold.waf_api.service.ActivityLogService;
import tech.noetzold.waf_api.service.ClassificationLogService;
import tech.noetzold.waf_api.service.LiveEventService;
import tech.noetzold.waf_api.service.RuleStore;
import tech.noetzold.waf_api.service.StatsService;
import tech.noetzold.waf_api.service.TechniqueStore;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Dashboard")
public class DashboardController {

    private final StatsService statsService;
    private final TechniqueStore techniqueStore;
    private final ActivityLogService activityLog;
    private final ClassificationLogService classificationLog;
    private final RuleStore ruleStore;
    private final LiveEventService liveEvents;

    public DashboardController(StatsService statsService,
                               TechniqueStore techniqueStore,
                               ActivityLogService activityLog,
                               ClassificationLogService classificationLog,
                               RuleStore ruleStore,
                               LiveEventService liveEvents) {
        this.statsService = statsService;
        this.techniqueStore = techniqueStore;
        this.activityLog = activityLog;
        this.classificationLog = classificationLog;
        this.ruleStore = ruleStore;
        this.liveEvents = liveEvents;
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        return statsService.current();
    }

    @GetMapping("/threats")
    public List<ThreatResponse> threats() {
        return techniqueStore.findAllNewestFirst().stream().map(ThreatResponse::fromEntity).toList();
    }

    @GetMapping("/threats/{id}")
    public ResponseEntity<ThreatResponse> threat(@PathVariable("id") Long id) {
        return techniqueStore.findById(id)
                .map(ThreatResponse::fromEntity)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/agents")
    public List<AgentLogEntry> agents() {
        return activityLog.recent();
    }

    @GetMapping("/requests")
    public List<RequestLogEntry> requests() {
        return classificationLog.recent();
    }

    @GetMapping("/rules")
    public List<RuleVersionResponse> rules() {
        return ruleStore.history().stream().map(RuleVersionResponse::summaryOf).toList();
    }

    @GetMapping("/rules/current")
    public RuleVersionResponse currentRules() {
        return RuleVersionResponse.fromEntity(ruleStore.current());
    }

    @GetMapping("/events")
    public List<LiveEvent> events(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return liveEvents.recent(Math.max(0, Math.min(limit, 200)));
    }
}
