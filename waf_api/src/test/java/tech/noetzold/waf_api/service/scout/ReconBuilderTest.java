package tech.noetzold.waf_api.service.scout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.Technique;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReconBuilder")
class ReconBuilderTest {

    private long ids;

    @Test
    @DisplayName("Should rank tested categories by block rate and flag thin ones as unexplored")
    void shouldBuildBrief() {
        // Given
        List<Technique> catalog = new ArrayList<>();
        catalog.add(technique(AttackCategory.SQLI, true, true));
        catalog.add(technique(AttackCategory.SQLI, true, false));
        catalog.add(technique(AttackCategory.SQLI, true, false));
        catalog.add(technique(AttackCategory.SQLI, true, false));
        catalog.add(technique(AttackCategory.XSS, true, true));
        catalog.add(technique(AttackCategory.XSS, true, true));
        catalog.add(technique(AttackCategory.SSRF, false, false));

        // When
        ReconBrief brief = ReconBuilder.build(catalog, List.of(), 4);

        // Then
        assertThat(brief.weakCategories()).extracting(CategoryStat::category)
                .containsExactly(AttackCategory.SQLI, AttackCategory.XSS);
        assertThat(brief.weakCategories().get(0).blockRate()).isEqualTo(0.25);
        assertThat(brief.unexplored())
                .contains(AttackCategory.XSS, AttackCategory.SSRF, AttackCategory.XXE, AttackCategory.RCE)
                .doesNotContain(AttackCategory.SQLI);
        assertThat(brief.totalTechniques()).isEqualTo(7);
        assertThat(brief.generation()).isEqualTo(4);
        assertThat(brief.hasRecentBypasses()).isFalse();
    }

    @Test
    @DisplayName("Should cap the weak list at five categories")
    void shouldCapWeakList() {
        List<Technique> catalog = new ArrayList<>();
        for (AttackCategory category : AttackCategory.values()) {
            catalog.add(technique(category, true, false));
        }

        assertThat(ReconBuilder.build(catalog, List.of(), 0).weakCategories()).hasSize(5);
    }

    private Technique technique(AttackCategory category, boolean tested, boolean blocked) {
        return Technique.builder()
                .id(++ids)
                .techniqueName("technique-" + ids)
                .category(category)
                .rawPayload("payload-" + ids)
                .testedAt(tested ? Instant.EPOCH : null)
                .blocked(blocked)
                .build();
    }
}
