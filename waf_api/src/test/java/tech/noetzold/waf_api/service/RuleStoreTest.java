package tech.noetzold.waf_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import tech.noetzold.waf_api.model.RuleAuthor;
import tech.noetzold.waf_api.model.RuleVersion;
import tech.noetzold.waf_api.repository.RuleVersionRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({RuleStore.class, PromptLibrary.class, RuleStoreTest.FixedClockConfig.class})
@DisplayName("RuleStore Repository Tests")
class RuleStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private RuleStore ruleStore;

    @Autowired
    private RuleVersionRepository ruleVersionRepository;

    @Autowired
    private PromptLibrary promptLibrary;

    @BeforeEach
    void setUp() {
        ruleVersionRepository.deleteAll();
    }

    @Test
    @DisplayName("Should report shipped defaults as v1 before anything is stored")
    void shouldFallBackToDefaults() {
        // When
        RuleVersion current = ruleStore.current();

        // Then
        assertThat(current.getVersion()).isEqualTo(1);
        assertThat(current.getFastPrompt()).isEqualTo(promptLibrary.fastEngineDefault());
        assertThat(current.getUpdatedBy()).isEqualTo(RuleAuthor.SYSTEM);
        assertThat(ruleVersionRepository.count()).isZero();
    }

    @Test
    @DisplayName("Should seed once and leave an existing history alone")
    void shouldSeedOnce() {
        // When
        RuleVersion first = ruleStore.seedIfEmpty();
        RuleVersion second = ruleStore.seedIfEmpty();

        // Then
        assertThat(first.getVersion()).isEqualTo(1);
        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(ruleVersionRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should deploy the exact pair as the next version")
    void shouldDeployNextVersion() {
        // Given
        ruleStore.seedIfEmpty();

        // When
        RuleVersion deployed = ruleStore.deploy("fast v2", "deep v2", RuleAuthor.ADAPT);

        // Then
        RuleVersion current = ruleStore.current();
        assertThat(deployed.getVersion()).isEqualTo(2);
        assertThat(current.getVersion()).isEqualTo(2);
        assertThat(current.getFastPrompt()).isEqualTo("fast v2");
        assertThat(current.getDeepPrompt()).isEqualTo("deep v2");
        assertThat(current.getUpdatedBy()).isEqualTo(RuleAuthor.ADAPT);
        assertThat(current.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should list history newest first without rewriting older versions")
    void shouldKeepHistory() {
        // Given
        ruleStore.seedIfEmpty();
        ruleStore.deploy("fast v2", "deep v2", RuleAuthor.ADAPT);
        ruleStore.deploy("fast v2", "deep v2", RuleAuthor.HEURISTIC);

        // When
        List<RuleVersion> history = ruleStore.history();

        // Then
        assertThat(history).extracting(RuleVersion::getVersion).containsExactly(3, 2, 1);
        assertThat(history.get(2).getFastPrompt()).isEqualTo(promptLibrary.fastEngineDefault());
        assertThat(history.get(0).getUpdatedBy()).isEqualTo(RuleAuthor.HEURISTIC);
    }
}
