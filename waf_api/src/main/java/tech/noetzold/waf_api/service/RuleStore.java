package tech.noetzold.waf_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.waf_api.model.RuleAuthor;
import tech.noetzold.waf_api.model.RuleVersion;
import tech.noetzold.waf_api.repository.RuleVersionRepository;

import java.time.Clock;
import java.util.List;

/**
 * Append-only history of engine instruction pairs. The current pair is the highest version;
 * a deployment is one insert and never touches earlier rows.
 */
@Slf4j
@Service
public class RuleStore {

    private final RuleVersionRepository ruleVersionRepository;
    private final PromptLibrary promptLibrary;
    private final Clock clock;

    public RuleStore(RuleVersionRepository ruleVersionRepository, PromptLibrary promptLibrary, Clock clock) {
        this.ruleVersionRepository = ruleVersionRepository;
        this.promptLibrary = promptLibrary;
        this.clock = clock;
    }

    /** Falls back to the shipped defaults as version 1 when nothing has been stored yet. */
    public RuleVersion current() {
        return ruleVersionRepository.findTopByOrderByVersionDesc().orElseGet(this::defaults);
    }

    public RuleVersion seedIfEmpty() {
        return ruleVersionRepository.findTopByOrderByVersionDesc().orElseGet(() -> {
            RuleVersion seeded = ruleVersionRepository.save(defaults());
            log.info("Seeded rule store with default rules v{}", seeded.getVersion());
            return seeded;
        });
    }

    public RuleVersion deploy(String fastPrompt, String deepPrompt, RuleAuthor author) {
        RuleVersion previous = current();
        RuleVersion next = RuleVersion.builder()
                .version(previous.getVersion() + 1)
                .fastPrompt(fastPrompt)
                .deepPrompt(deepPrompt)
                .updatedAt(clock.instant())
                .updatedBy(author)
                .build();
        RuleVersion saved = ruleVersionRepository.save(next);
        log.info("Deployed rules v{} -> v{} by {}", previous.getVersion(), saved.getVersion(), author.getWireName());
        return saved;
    }

    /** Newest first. */
    public List<RuleVersion> history() {
        return ruleVersionRepository.findAllByOrderByVersionDesc();
    }

    /** The shipped prompt pair as an unsaved version 1. Needs no database. */
    public RuleVersion defaults() {
        return RuleVersion.builder()
                .version(1)
                .fastPrompt(promptLibrary.fastEngineDefault())
                .deepPrompt(promptLibrary.deepEngineDefault())
                .updatedAt(clock.instant())
                .updatedBy(RuleAuthor.SYSTEM)
                .build();
    }
}
