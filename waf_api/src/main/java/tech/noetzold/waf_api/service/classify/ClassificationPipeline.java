package tech.noetzold.waf_api.service.classify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import tech.noetzold.waf_api.client.DeepEngineClient;
import tech.noetzold.waf_api.client.FastEngineClient;
import tech.noetzold.waf_api.client.LanguageEngine;
import tech.noetzold.waf_api.model.Classification;
import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.model.RuleVersion;
import tech.noetzold.waf_api.service.ClassificationLogService;
import tech.noetzold.waf_api.service.RuleStore;

/**
 * Three escalating stages producing one verdict per request.
 * <ul>
 *     <li>Stage 0, the local {@link PatternMatcher}, always runs.</li>
 *     <li>Stage 1, the fast engine, replaces the verdict when it says MALICIOUS, or SUSPICIOUS
 *     while Stage 0 did not say MALICIOUS.</li>
 *     <li>Stage 2, the deep engine, only sees flagged requests. It may escalate to MALICIOUS and may
 *     clear to SAFE unless Stage 0 found MALICIOUS on its own.</li>
 * </ul>
 * A request is blocked iff the final verdict is MALICIOUS above {@value #BLOCK_THRESHOLD}.
 */
@Slf4j
@Service
public class ClassificationPipeline {

    public static final double BLOCK_THRESHOLD = 0.6;

    static final int FAST_MAX_TOKENS = 200;
    static final int DEEP_MAX_TOKENS = 300;

    private final PatternMatcher patternMatcher;
    private final LanguageEngine fastEngine;
    private final LanguageEngine deepEngine;
    private final EngineResponseParser responseParser;
    private final RuleStore ruleStore;
    private final ClassificationLogService classificationLogService;

    public ClassificationPipeline(PatternMatcher patternMatcher,
                                  FastEngineClient fastEngine,
                                  DeepEngineClient deepEngine,
                                  EngineResponseParser responseParser,
                                  RuleStore ruleStore,
                                  ClassificationLogService classificationLogService) {
        this.patternMatcher = patternMatcher;
        this.fastEngine = fastEngine;
        this.deepEngine = deepEngine;
        this.responseParser = responseParser;
        this.ruleStore = ruleStore;
        this.classificationLogService = classificationLogService;
    }

    public ClassificationVerdict classify(String rawRequest) {
        long start = System.nanoTime();
        RuleVersion rules = currentRules();

        Stage0Result stage0 = patternMatcher.classify(rawRequest);
        StageVerdict current = stage0;

        if (fastEngine.isConfigured()) {
            EngineResult fast = consult(fastEngine, rules.getFastPrompt(), rawRequest, FAST_MAX_TOKENS);
            if (fast.classification() == Classification.MALICIOUS
                    || (fast.classification() == Classification.SUSPICIOUS
                    && stage0.classification() != Classification.MALICIOUS)) {
                current = fast;
            }
        }

        if (deepEngine.isConfigured() && current.classification().isFlagged()) {
            EngineResult deep = consult(deepEngine, rules.getDeepPrompt(), rawRequest, DEEP_MAX_TOKENS);
            if (deep.classification() == Classification.MALICIOUS) {
                current = deep;
            } else if (deep.classification() == Classification.SAFE
                    && stage0.classification() != Classification.MALICIOUS) {
                current = deep;
            }
        }

        boolean blocked = current.classification() == Classification.MALICIOUS
                && current.confidence() > BLOCK_THRESHOLD;

        ClassificationVerdict verdict = ClassificationVerdict.builder()
                .classification(current.classification())
                .confidence(current.confidence())
                .attack_type(current.attackType())
                .reason(current.reason())
                .classifier(current.classifier())
                .blocked(blocked)
                .response_time_ms(round1((System.nanoTime() - start) / 1_000_000.0))
                .rules_version(rules.getVersion())
                .build();

        log.debug("Classified request as {} ({}) by {} blocked={}", verdict.getClassification(),
                verdict.getConfidence(), verdict.getClassifier(), blocked);
        classificationLogService.record(rawRequest, verdict);
        return verdict;
    }

    // Stage 0 needs no rules, so a store outage must not cost the caller a verdict
    private RuleVersion currentRules() {
        try {
            return ruleStore.current();
        } catch (DataAccessException e) {
            log.warn("Rule store unavailable, classifying with default rules: {}", e.getMessage());
            return ruleStore.defaults();
        }
    }

    /** Never throws: failures and unreadable replies become a degraded SUSPICIOUS verdict. */
    EngineResult consult(LanguageEngine engine, String prompt, String rawRequest, int maxTokens) {
        long start = System.nanoTime();
        try {
            String text = engine.complete(prompt, rawRequest, maxTokens);
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            EngineOutcome outcome = responseParser.parse(text);
            if (outcome instanceof EngineOutcome.ParsedVerdict parsed) {
                return new EngineResult(parsed.classification(), parsed.confidence(), parsed.attackType(),
                        parsed.reason(), engine.name(), elapsedMs, false);
            }
            String reason = ((EngineOutcome.ParseFailure) outcome).reason();
            log.warn("{} engine reply unusable: {}", engine.name(), reason);
            return EngineResult.degraded(engine.name(), reason, elapsedMs);
        } catch (RuntimeException e) {
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            log.warn("{} engine call failed: {}", engine.name(), e.getMessage());
            return EngineResult.degraded(engine.name(), engine.name() + " API error: " + e.getMessage(), elapsedMs);
        }
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
