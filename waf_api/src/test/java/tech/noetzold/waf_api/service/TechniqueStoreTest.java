package tech.noetzold.waf_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.Severity;
import tech.noetzold.waf_api.model.Technique;
import tech.noetzold.waf_api.model.TechniqueCandidate;
import tech.noetzold.waf_api.repository.TechniqueRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TechniqueStore Unit Tests")
class TechniqueStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private TechniqueRepository techniqueRepository;

    private TechniqueStore techniqueStore;

    @BeforeEach
    void setUp() {
        techniqueStore = new TechniqueStore(techniqueRepository, Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(techniqueRepository.save(any(Technique.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("Should reject duplicates by name and by normalised payload")
    void shouldDeduplicate() {
        // Given
        when(techniqueRepository.findAll()).thenReturn(List.of(Technique.builder()
                .id(1L).techniqueName("Classic tautology").rawPayload("' OR 1=1 --").build()));
        List<TechniqueCandidate> candidates = List.of(
                candidate("CLASSIC TAUTOLOGY", "' OR 2=2 --"),
                candidate("Encoded tautology", "%27%20OR%201%3D1%20--"),
                candidate("SVG onload", "<svg onload=alert(1)>"),
                candidate("SVG onload, shouty", "<SVG   onload=alert(1)>"),
                candidate("Missing payload", " "));

        // When
        List<Technique> stored = techniqueStore.storeNew(candidates, "scout/mutate_bypasses");

        // Then
        assertThat(stored).extracting(Technique::getTechniqueName).containsExactly("SVG onload");
        verify(techniqueRepository, times(1)).save(any(Technique.class));
    }

    @Test
    @DisplayName("Should coerce unknown category and severity instead of rejecting")
    void shouldCoerceEnums() {
        // Given
        when(techniqueRepository.findAll()).thenReturn(List.of());

        // When
        List<Technique> stored = techniqueStore.storeNew(List.of(
                new TechniqueCandidate("Prototype pollution", "prototype_pollution",
                        "{\"__proto__\": {\"admin\": true}}", "extreme", null)), "scout/emerging_techniques");

        // Then
        Technique t = stored.get(0);
        assertThat(t.getCategory()).isEqualTo(AttackCategory.ENCODING_EVASION);
        assertThat(t.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(t.getSource()).isEqualTo("scout/emerging_techniques");
        assertThat(t.getDiscoveredAt()).isEqualTo(NOW);
        assertThat(t.isBlocked()).isFalse();
    }

    @Test
    @DisplayName("Should only mark verified techniques blocked when patching")
    void shouldSeparateVerifiedFromAttempted() {
        // When
        techniqueStore.markPatched(List.of(1L, 2L, 3L), Set.of(1L, 9L));

        // Then
        verify(techniqueRepository).updateBlockedAndPatched(Set.of(1L), NOW);
        verify(techniqueRepository).updatePatchedAt(Set.of(2L, 3L), NOW);
        verify(techniqueRepository, never()).save(any(Technique.class));
    }

    @Test
    @DisplayName("Should write status through column-scoped updates instead of saving loaded rows")
    void shouldUseTargetedUpdates() {
        // Given
        when(techniqueRepository.updateTestOutcome(5L, false, NOW)).thenReturn(1);

        // When
        techniqueStore.recordTestOutcome(5L, false);
        techniqueStore.markBlockedAndPatched(List.of(6L, 7L));
        techniqueStore.markBlockedAndPatched(List.of());

        // Then
        verify(techniqueRepository).updateTestOutcome(5L, false, NOW);
        verify(techniqueRepository, times(1)).updateBlockedAndPatched(any(), any());
        verify(techniqueRepository).updateBlockedAndPatched(List.of(6L, 7L), NOW);
        verify(techniqueRepository, never()).findById(any());
        verify(techniqueRepository, never()).findAllById(any());
        verify(techniqueRepository, never()).save(any(Technique.class));
    }

    private static TechniqueCandidate candidate(String name, String payload) {
        return new TechniqueCandidate(name, "sqli", payload, "high", null);
    }
}
