package tech.noetzold.waf_api.service.scout;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tech.noetzold.waf_api.client.DeepEngineClient;
import tech.noetzold.waf_api.client.LanguageEngine;
import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.Hint;
import tech.noetzold.waf_api.model.Strategy;
import tech.noetzold.waf_api.model.Technique;
import tech.noetzold.waf_api.model.TechniqueCandidate;
import tech.noetzold.waf_api.service.ActivityLogService;
import tech.noetzold.waf_api.service.PromptLibrary;
import tech.noetzold.waf_api.service.TechniqueStore;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Discovery phase: seed, recon, strategy selection, generation and deduplicated storage.
 */
@Slf4j
@Service
public class ScoutAgent {

    public static final String AGENT = "scout";

    static final int GENERATION_MAX_TOKENS = 2500;

    private final TechniqueStore techniqueStore;
    private final ActivityLogService activityLog;
    private final LanguageEngine generator;
    private final CandidateParser candidateParser;
    private final PromptLibrary promptLibrary;
    private final int batchSize;

    public ScoutAgent(TechniqueStore techniqueStore,
                      ActivityLogService activityLog,
                      DeepEngineClient generator,
                      CandidateParser candidateParser,
                      PromptLibrary promptLibrary,
                      @Value("${waf.scout.batch-size:5}") int batchSize) {
        this.techniqueStore = techniqueStore;
        this.activityLog = activityLog;
        this.generator = generator;
        this.candidateParser = candidateParser;
        this.promptLibrary = promptLibrary;
        this.batchSize = batchSize;
    }

    /**
     * @param hint feedback from the previous cycle, or {@code null}
     */
    public ScoutReport run(Hint hint) {
        int discovered = techniqueStore.seedIfAbsent(SeedTechniques.ALL);

        ReconBrief recon = ReconBuilder.build(
                techniqueStore.findAll(),
                techniqueStore.recentBypasses(),
                activityLog.count(AGENT, "scan"));
        List<Strategy> strategies = StrategySelector.select(recon, hint);
        log.info("Scout generation {} strategies {}{}", recon.generation(), strategies,
                hint == null ? "" : " (hint " + hint.dominantFailureMode() + ")");

        Set<AttackCategory> touched = EnumSet.noneOf(AttackCategory.class);
        if (generator.isConfigured()) {
            for (Strategy strategy : strategies) {
                try {
                    String reply = generator.complete(promptLibrary.scoutSystem(),
                            ScoutPromptBuilder.build(strategy, recon, hint, batchSize), GENERATION_MAX_TOKENS);
                    List<TechniqueCandidate> candidates = candidateParser.parse(reply);
                    List<Technique> stored = techniqueStore.storeNew(candidates, AGENT + "/" + strategy.getWireName());
                    stored.forEach(t -> touched.add(t.getCategory()));
                    discovered += stored.size();
                    log.info("Strategy {} produced {} candidates, {} new", strategy.getWireName(),
                            candidates.size(), stored.size());
                } catch (RuntimeException e) {
                    log.warn("Strategy {} failed: {}", strategy.getWireName(), e.getMessage());
                    activityLog.record(AGENT, "generation_error",
                            "Strategy " + strategy.getWireName() + " failed: " + e.getMessage(), false);
                }
            }
        } else {
            log.info("No generator configured, Scout only seeds and runs recon");
        }

        activityLog.record(AGENT, "scan", scanDetail(discovered, strategies, hint), true);
        return new ScoutReport(discovered, strategies, Set.copyOf(touched), recon.generation());
    }

    static String scanDetail(int discovered, List<Strategy> strategies, Hint hint) {
        StringBuilder detail = new StringBuilder("Discovered " + discovered + " techniques via "
                + strategies.get(0).getWireName() + " strategy");
        if (strategies.size() > 1) {
            detail.append(" (+")
                    .append(strategies.subList(1, strategies.size()).stream()
                            .map(Strategy::getWireName).collect(Collectors.joining(", ")))
                    .append(" secondary)");
        }
        if (hint != null) {
            detail.append(" [hint: ")
                    .append(hint.dominantFailureMode() == null ? "none" : hint.dominantFailureMode().getWireName())
                    .append(']');
        }
        return detail.toString();
    }
}
