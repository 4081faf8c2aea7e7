package tech.noetzold.waf_api.service.scout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.FailureMode;
import tech.noetzold.waf_api.model.Hint;
import tech.noetzold.waf_api.model.Strategy;
import tech.noetzold.waf_api.model.Technique;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StrategySelector")
class StrategySelectorTest {

    @Test
    @DisplayName("Should rotate the primary strategy by generation")
    void shouldRotate() {
        assertThat(StrategySelector.select(recon(0, false), null)).containsExactly(Strategy.MUTATE_BYPASSES);
        assertThat(StrategySelector.select(recon(7, false), null)).containsExactly(Strategy.CROSS_CATEGORY);
        assertThat(StrategySelector.select(recon(11, false), null)).containsExactly(Strategy.TARGET_WEAK_SPOTS);
    }

    @Test
    @DisplayName("Should append mutation as secondary when recent bypasses exist")
    void shouldAppendMutation() {
        assertThat(StrategySelector.select(recon(2, true), null))
                .containsExactly(Strategy.ENCODING_CHAINS, Strategy.MUTATE_BYPASSES);
        assertThat(StrategySelector.select(recon(6, true), null))
                .containsExactly(Strategy.MUTATE_BYPASSES);
    }

    @Test
    @DisplayName("Should prepend the counter-strategy and keep the rotated one behind it")
    void shouldPrependCounter() {
        // Given
        Hint hint = new Hint(FailureMode.ENCODING_EVASION, Set.of(AttackCategory.XSS), Set.of());

        // When
        List<Strategy> strategies = StrategySelector.select(recon(1, false), hint);

        // Then
        assertThat(strategies).containsExactly(Strategy.ENCODING_CHAINS, Strategy.CROSS_CATEGORY);
    }

    @Test
    @DisplayName("Should not duplicate a counter-strategy the rotation already chose")
    void shouldNotDuplicate() {
        Hint hint = new Hint(FailureMode.SEMANTIC_MISS, Set.of(), Set.of());

        assertThat(StrategySelector.select(recon(1, false), hint)).containsExactly(Strategy.CROSS_CATEGORY);
    }

    @Test
    @DisplayName("Should force mutation when the previous cycle left bypasses unresolved")
    void shouldForceMutation() {
        Hint hint = new Hint(FailureMode.CONFIDENCE_UNDERFLOW, Set.of(), Set.of(4L, 9L));

        assertThat(StrategySelector.select(recon(3, false), hint))
                .containsExactly(Strategy.TARGET_WEAK_SPOTS, Strategy.CONTEXT_SHIFT, Strategy.MUTATE_BYPASSES);
    }

    private static ReconBrief recon(long generation, boolean withBypasses) {
        List<Technique> bypasses = withBypasses
                ? List.of(Technique.builder().id(1L).techniqueName("t").rawPayload("p").build())
                : List.of();
        return new ReconBrief(List.of(), List.of(), bypasses, 10, generation);
    }
}
