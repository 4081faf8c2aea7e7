package tech.noetzold.waf_api.service.adapt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tech.noetzold.waf_api.client.ClassifyEndpointClient;
import tech.noetzold.waf_api.client.DeepEngineClient;
import tech.noetzold.waf_api.client.LanguageEngine;
import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.model.FailureMode;
import tech.noetzold.waf_api.model.RuleAuthor;
import tech.noetzold.waf_api.model.RuleVersion;
import tech.noetzold.waf_api.service.ActivityLogService;
import tech.noetzold.waf_api.service.PromptLibrary;
import tech.noetzold.waf_api.service.RuleStore;
import tech.noetzold.waf_api.service.TechniqueStore;
import tech.noetzold.waf_api.service.redteam.BypassResult;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Patch phase: diagnose bypasses, ask the generator for a replacement rule pair, deploy it as a
 * new version and re-check the most dangerous bypasses against the live endpoint.
 */
@Slf4j
@Service
public class AdaptAgent {

    public static final String AGENT = "adapt";

    static final int GENERATION_MAX_TOKENS = 4000;

    private final RuleStore ruleStore;
    private final TechniqueStore techniqueStore;
    private final ActivityLogService activityLog;
    private final LanguageEngine generator;
    private final RuleUpdateParser ruleUpdateParser;
    private final ClassifyEndpointClient classifyClient;
    private final PromptLibrary promptLibrary;
    private final ObjectMapper objectMapper;
    private final int verifySample;

    public AdaptAgent(RuleStore ruleStore,
                      TechniqueStore techniqueStore,
                      ActivityLogService activityLog,
                      DeepEngineClient generator,
                      RuleUpdateParser ruleUpdateParser,
                      ClassifyEndpointClient classifyClient,
                      PromptLibrary promptLibrary,
                      ObjectMapper objectMapper,
                      @Value("${waf.adapt.verify-sample:3}") int verifySample) {
        this.ruleStore = ruleStore;
        this.techniqueStore = techniqueStore;
        this.activityLog = activityLog;
        this.generator = generator;
        this.ruleUpdateParser = ruleUpdateParser;
        this.classifyClient = classifyClient;
        this.promptLibrary = promptLibrary;
        this.objectMapper = objectMapper;
        this.verifySample = verifySample;
    }

    /**
     * @param bypasses confirmed bypasses, most dangerous first; must not be empty
     */
    public AdaptReport run(List<BypassResult> bypasses) {
        if (bypasses == null || bypasses.isEmpty()) {
            throw new IllegalArgumentException("Adapt needs at least one bypass");
        }

        List<BypassResult> diagnosed = FailureModeClassifier.diagnoseAll(bypasses);
        Map<FailureMode, Integer> modes = FailureModeClassifier.countByMode(diagnosed);
        FailureMode dominant = FailureModeClassifier.dominant(diagnosed);
        Set<AttackCategory> weak = EnumSet.noneOf(AttackCategory.class);
        diagnosed.forEach(b -> weak.add(b.category()));
        log.info("Adapt diagnosed {} bypasses: {} (dominant {})", diagnosed.size(), modes, dominant);

        RuleVersion previous = ruleStore.current();
        if (!generator.isConfigured()) {
            return heuristic(previous, diagnosed, modes, dominant, weak, "no rule generator configured");
        }

        RuleUpdate update;
        try {
            String evidence = objectMapper.writeValueAsString(EvidenceReport.of(diagnosed));
            String reply = generator.complete(promptLibrary.adaptSystem(),
                    generationRequest(previous, evidence), GENERATION_MAX_TOKENS);
            update = ruleUpdateParser.parse(reply, previous);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Rule generation failed, falling back to heuristic patch: {}", e.getMessage());
            return heuristic(previous, diagnosed, modes, dominant, weak, e.getMessage());
        }

        RuleVersion deployed = ruleStore.deploy(update.fastPrompt(), update.deepPrompt(), RuleAuthor.ADAPT);

        Set<Long> attempted = diagnosed.stream().map(BypassResult::techniqueId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<Long> verified = verify(diagnosed.subList(0, Math.min(verifySample, diagnosed.size())));
        techniqueStore.markPatched(attempted, verified);

        Set<Long> stillBypassing = new LinkedHashSet<>(attempted);
        stillBypassing.removeAll(verified);

        activityLog.record(AGENT, "adapt", String.format("v%d->v%d: %s. Patched %d, verified %d.",
                previous.getVersion(), deployed.getVersion(),
                update.analysis().isEmpty() ? "no analysis given" : update.analysis(),
                attempted.size(), verified.size()), true);
        log.info("Adapt deployed rules v{}: {} patched, {} verified, {} new patterns",
                deployed.getVersion(), attempted.size(), verified.size(), update.newPatterns().size());

        return new AdaptReport(previous.getVersion(), deployed.getVersion(), attempted.size(), verified.size(),
                false, update.analysis(), update.newPatterns(), dominant, modes, weak, stillBypassing);
    }

    /** A bypass counts as verified only when the live endpoint now answers blocked=true. */
    Set<Long> verify(List<BypassResult> sample) {
        Set<Long> verified = new HashSet<>();
        for (BypassResult bypass : sample) {
            try {
                ClassificationVerdict verdict = classifyClient.classify(bypass.rawPayload());
                if (verdict.isBlocked()) {
                    verified.add(bypass.techniqueId());
                }
            } catch (RuntimeException e) {
                log.warn("Verification of '{}' failed: {}", bypass.techniqueName(), e.getMessage());
            }
        }
        return verified;
    }

    private AdaptReport heuristic(RuleVersion previous, List<BypassResult> diagnosed,
                                  Map<FailureMode, Integer> modes, FailureMode dominant,
                                  Set<AttackCategory> weak, String reason) {
        RuleVersion deployed = ruleStore.deploy(previous.getFastPrompt(), previous.getDeepPrompt(), RuleAuthor.HEURISTIC);
        List<Long> ids = diagnosed.stream().map(BypassResult::techniqueId).toList();
        techniqueStore.markBlockedAndPatched(ids);

        activityLog.record(AGENT, "heuristic", String.format(
                "v%d->v%d: rules carried forward (%s). Marked %d bypasses blocked.",
                previous.getVersion(), deployed.getVersion(), reason, ids.size()), true);
        log.info("Heuristic patch v{} -> v{} for {} bypasses", previous.getVersion(), deployed.getVersion(), ids.size());

        return new AdaptReport(previous.getVersion(), deployed.getVersion(), ids.size(), 0,
                true, "", List.of(), dominant, modes, weak, Set.of());
    }

    static String generationRequest(RuleVersion current, String evidenceJson) {
        return "CURRENT FAST CLASSIFIER PROMPT (v" + current.getVersion() + "):\n"
                + current.getFastPrompt() + "\n\n"
                + "CURRENT DEEP CLASSIFIER PROMPT (v" + current.getVersion() + "):\n"
                + current.getDeepPrompt() + "\n\n"
                + "BYPASS EVIDENCE REPORT:\n"
                + evidenceJson + "\n\n"
                + "Return the complete updated prompts as the JSON object described above.";
    }
}
