package tech.noetzold.waf_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.Severity;
import tech.noetzold.waf_api.model.Technique;
import tech.noetzold.waf_api.model.TechniqueCandidate;
import tech.noetzold.waf_api.repository.TechniqueRepository;
import tech.noetzold.waf_api.util.PercentDecoding;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog of attack techniques and their test, block and patch status. Rows are never deleted;
 * status updates are column-scoped UPDATE statements keyed by primary key.
 */
@Slf4j
@Service
public class TechniqueStore {

    private final TechniqueRepository techniqueRepository;
    private final Clock clock;

    public TechniqueStore(TechniqueRepository techniqueRepository, Clock clock) {
        this.techniqueRepository = techniqueRepository;
        this.clock = clock;
    }

    /**
     * Inserts seed techniques whose exact name is not catalogued yet.
     *
     * @return number of rows inserted
     */
    public int seedIfAbsent(List<TechniqueCandidate> seeds) {
        int added = 0;
        for (TechniqueCandidate seed : seeds) {
            if (techniqueRepository.existsByTechniqueNameIgnoreCase(seed.technique_name())) continue;
            techniqueRepository.save(toEntity(seed, seed.source()));
            added++;
        }
        if (added > 0) {
            log.info("Seeded {} techniques", added);
        }
        return added;
    }

    /**
     * Stores candidates that survive validation and deduplication. A candidate is a duplicate when
     * its name matches case-insensitively or its normalised payload matches, against the catalog and
     * against earlier candidates of the same batch.
     *
     * @return the rows actually inserted
     */
    public List<Technique> storeNew(List<TechniqueCandidate> candidates, String source) {
        List<Technique> stored = new ArrayList<>();
        if (candidates == null || candidates.isEmpty()) return stored;

        Set<String> names = new HashSet<>();
        Set<String> payloads = new HashSet<>();
        for (Technique existing : techniqueRepository.findAll()) {
            names.add(existing.getTechniqueName().toLowerCase(Locale.ROOT));
            payloads.add(PercentDecoding.normalizePayload(existing.getRawPayload()));
        }

        for (TechniqueCandidate candidate : candidates) {
            if (candidate == null || !candidate.isComplete()) continue;

            String name = candidate.technique_name().trim();
            String nameKey = name.toLowerCase(Locale.ROOT);
            String payloadKey = PercentDecoding.normalizePayload(candidate.raw_payload());
            if (names.contains(nameKey) || payloads.contains(payloadKey)) {
                log.debug("Skipping duplicate technique '{}'", name);
                continue;
            }

            try {
                stored.add(techniqueRepository.save(toEntity(candidate, source)));
                names.add(nameKey);
                payloads.add(payloadKey);
            } catch (DataIntegrityViolationException e) {
                log.warn("Technique '{}' was inserted concurrently, skipping: {}", name, e.getMostSpecificCause().getMessage());
            }
        }
        return stored;
    }

    public List<Technique> findAll() {
        return techniqueRepository.findAll();
    }

    public List<Technique> findAllNewestFirst() {
        return techniqueRepository.findAllByOrderByDiscoveredAtDesc();
    }

    public Optional<Technique> findById(Long id) {
        return techniqueRepository.findById(id);
    }

    public List<Technique> findAllById(Collection<Long> ids) {
        return techniqueRepository.findAllById(ids);
    }

    public List<Technique> neverTested() {
        return techniqueRepository.findByTestedAtIsNullOrderByDiscoveredAtDesc();
    }

    public List<Technique> confirmedBypasses() {
        return techniqueRepository.findByBlockedFalseAndTestedAtIsNotNullOrderByTestedAtAsc();
    }

    public List<Technique> recentlyPatched(int limit) {
        return techniqueRepository.findByPatchedAtIsNotNullAndBlockedTrueOrderByPatchedAtDesc(PageRequest.of(0, limit));
    }

    public List<Technique> recentBypasses() {
        return techniqueRepository.findTop5ByBlockedFalseAndTestedAtIsNotNullOrderByTestedAtDesc();
    }

    public void recordTestOutcome(Long id, boolean blocked) {
        if (techniqueRepository.updateTestOutcome(id, blocked, clock.instant()) == 0) {
            log.debug("Technique {} vanished before its outcome was recorded", id);
        }
    }

    /**
     * Verified ids become blocked and patched; the rest of {@code attempted} only get a patch timestamp.
     */
    public void markPatched(Collection<Long> attempted, Set<Long> verified) {
        if (attempted.isEmpty()) return;
        Instant now = clock.instant();
        Set<Long> blocked = new HashSet<>(attempted);
        blocked.retainAll(verified);
        Set<Long> onlyPatched = new HashSet<>(attempted);
        onlyPatched.removeAll(blocked);

        if (!onlyPatched.isEmpty()) {
            techniqueRepository.updatePatchedAt(onlyPatched, now);
        }
        if (!blocked.isEmpty()) {
            techniqueRepository.updateBlockedAndPatched(blocked, now);
        }
    }

    public void markBlockedAndPatched(Collection<Long> ids) {
        if (ids.isEmpty()) return;
        techniqueRepository.updateBlockedAndPatched(ids, clock.instant());
    }

    private Technique toEntity(TechniqueCandidate candidate, String source) {
        return Technique.builder()
                .techniqueName(candidate.technique_name().trim())
                .category(AttackCategory.coerce(candidate.category()))
                .source(source)
                .rawPayload(candidate.raw_payload().trim())
                .severity(Severity.coerce(candidate.severity()))
                .discoveredAt(clock.instant())
                .blocked(false)
                .build();
    }
}
