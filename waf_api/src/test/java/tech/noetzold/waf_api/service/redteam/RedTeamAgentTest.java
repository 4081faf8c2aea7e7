package tech.noetzold.waf_api.service.redteam;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import tech.noetzold.waf_api.client.ClassifyCallException;
import tech.noetzold.waf_api.client.ClassifyEndpointClient;
import tech.noetzold.waf_api.config.AsyncConfig;
import tech.noetzold.waf_api.model.AttackCategory;
import tech.noetzold.waf_api.model.Classification;
import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.model.Severity;
import tech.noetzold.waf_api.model.Technique;
import tech.noetzold.waf_api.service.ActivityLogService;
import tech.noetzold.waf_api.service.TechniqueStore;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedTeamAgent Unit Tests")
class RedTeamAgentTest {

    @Mock
    private TechniqueStore techniqueStore;

    @Mock
    private ClassifyEndpointClient classifyClient;

    @Mock
    private ActivityLogService activityLog;

    private RedTeamAgent redTeamAgent;

    private final Technique blocked = technique(1L, "Union select", AttackCategory.SQLI, Severity.CRITICAL);
    private final Technique unsure = technique(2L, "Comment split", AttackCategory.SQLI, Severity.HIGH);
    private final Technique shrugged = technique(3L, "Header smuggle", AttackCategory.HEADER_INJECTION, Severity.LOW);
    private final Technique broken = technique(4L, "Chunked XSS", AttackCategory.XSS, Severity.MEDIUM);

    @BeforeEach
    void setUp() {
        TaskExecutor direct = Runnable::run;
        redTeamAgent = new RedTeamAgent(techniqueStore, classifyClient, activityLog, direct, 15, 5);
    }

    @Test
    @DisplayName("Should log and return an empty report when nothing is selectable")
    void shouldHandleEmptyCatalog() {
        // Given
        when(techniqueStore.neverTested()).thenReturn(List.of());
        when(techniqueStore.confirmedBypasses()).thenReturn(List.of());
        when(techniqueStore.recentlyPatched(5)).thenReturn(List.of());

        // When
        RedTeamReport report = redTeamAgent.run();

        // Then
        assertThat(report.tested()).isZero();
        assertThat(report.bypasses()).isEmpty();
        verify(activityLog).record("redteam", "red_team", "No techniques to test this cycle", true);
        verifyNoInteractions(classifyClient);
    }

    @Test
    @DisplayName("Should isolate a failing attack and rank bypasses by danger")
    void shouldRankAndIsolate() {
        // Given
        when(techniqueStore.neverTested()).thenReturn(List.of(blocked, unsure, shrugged, broken));
        when(techniqueStore.confirmedBypasses()).thenReturn(List.of());
        when(techniqueStore.recentlyPatched(5)).thenReturn(List.of());
        when(classifyClient.classify(blocked.getRawPayload())).thenReturn(verdict(Classification.MALICIOUS, 0.95, true));
        when(classifyClient.classify(unsure.getRawPayload())).thenReturn(verdict(Classification.SUSPICIOUS, 0.3, false));
        when(classifyClient.classify(shrugged.getRawPayload())).thenReturn(verdict(Classification.SAFE, 0.9, false));
        when(classifyClient.classify(broken.getRawPayload())).thenThrow(new ClassifyCallException("HTTP 502"));

        // When
        RedTeamReport report = redTeamAgent.run();

        // Then
        assertThat(report.tested()).isEqualTo(4);
        assertThat(report.blocked()).isEqualTo(1);
        assertThat(report.bypassed()).isEqualTo(2);
        assertThat(report.errors()).isEqualTo(1);
        assertThat(report.bypasses()).extracting(BypassResult::techniqueId).containsExactly(2L, 3L);
        assertThat(report.categoryBreakdown().get(AttackCategory.SQLI))
                .isEqualTo(new CategoryBreakdown(2, 1, 1, 0));

        verify(techniqueStore).recordTestOutcome(1L, true);
        verify(techniqueStore).recordTestOutcome(2L, false);
        verify(techniqueStore).recordTestOutcome(3L, false);
        verify(techniqueStore, never()).recordTestOutcome(eq(4L), anyBoolean());
        verify(activityLog).record("redteam", "error", "Failed to test Chunked XSS: HTTP 502", false);
        verify(activityLog).record(eq("redteam"), eq("red_team"),
                startsWith("Tested 4 techniques: 1 blocked, 2 bypasses, 1 errors."), eq(true));
    }

    @Test
    @DisplayName("Should re-test only the explicit residual set")
    void shouldRunOnResidual() {
        // Given
        when(techniqueStore.findAllById(Set.of(2L))).thenReturn(List.of(unsure));
        when(classifyClient.classify(unsure.getRawPayload())).thenReturn(verdict(Classification.MALICIOUS, 0.9, true));

        // When
        RedTeamReport report = redTeamAgent.runOn(Set.of(2L));

        // Then
        assertThat(report.tested()).isEqualTo(1);
        assertThat(report.bypasses()).isEmpty();
        verify(techniqueStore, never()).neverTested();
    }

    @Test
    @DisplayName("Should let persistence failures escape")
    void shouldPropagatePersistenceErrors() {
        // Given
        when(techniqueStore.findAllById(Set.of(1L))).thenReturn(List.of(blocked));
        when(classifyClient.classify(anyString())).thenReturn(verdict(Classification.MALICIOUS, 0.95, true));
        doThrow(new DataAccessResourceFailureException("db down")).when(techniqueStore).recordTestOutcome(1L, true);

        // When / Then
        assertThatThrownBy(() -> redTeamAgent.runOn(Set.of(1L)))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    @DisplayName("Should keep at most the configured number of attacks in flight and let a failure pass")
    void shouldBoundConcurrency() throws Exception {
        // Given
        ThreadPoolTaskExecutor pool = new AsyncConfig().redTeamExecutor(3);
        pool.initialize();
        RedTeamAgent bounded = new RedTeamAgent(techniqueStore, classifyClient, activityLog, pool, 15, 5);

        List<Technique> targets = LongStream.rangeClosed(11, 17)
                .mapToObj(id -> technique(id, "Technique " + id, AttackCategory.XSS, Severity.MEDIUM))
                .toList();
        when(techniqueStore.neverTested()).thenReturn(targets);
        when(techniqueStore.confirmedBypasses()).thenReturn(List.of());
        when(techniqueStore.recentlyPatched(5)).thenReturn(List.of());

        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch saturated = new CountDownLatch(3);
        CountDownLatch release = new CountDownLatch(1);
        when(classifyClient.classify(anyString())).thenAnswer(inv -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            saturated.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
                if (inv.getArgument(0, String.class).contains("id=11 ")) {
                    throw new ClassifyCallException("timed out after 30000ms");
                }
                return verdict(Classification.SAFE, 0.9, false);
            } finally {
                inFlight.decrementAndGet();
            }
        });

        try {
            // When
            CompletableFuture<RedTeamReport> running = CompletableFuture.supplyAsync(bounded::run);
            assertThat(saturated.await(5, TimeUnit.SECONDS)).isTrue();
            int inFlightWhileHeld = inFlight.get();
            release.countDown();
            RedTeamReport report = running.get(10, TimeUnit.SECONDS);

            // Then
            assertThat(inFlightWhileHeld).isEqualTo(3);
            assertThat(peak.get()).isLessThanOrEqualTo(3);
            assertThat(report.tested()).isEqualTo(7);
            assertThat(report.errors()).isEqualTo(1);
            assertThat(report.bypassed()).isEqualTo(6);
            verify(classifyClient, times(7)).classify(anyString());
            verify(techniqueStore, times(6)).recordTestOutcome(anyLong(), eq(false));
        } finally {
            pool.shutdown();
        }
    }

    private static Technique technique(long id, String name, AttackCategory category, Severity severity) {
        return Technique.builder()
                .id(id)
                .techniqueName(name)
                .category(category)
                .severity(severity)
                .rawPayload("GET /?id=" + id + " HTTP/1.1")
                .build();
    }

    private static ClassificationVerdict verdict(Classification classification, double confidence, boolean blocked) {
        return ClassificationVerdict.builder()
                .classification(classification)
                .confidence(confidence)
                .attack_type("none")
                .classifier("regex")
                .blocked(blocked)
                .build();
    }
}
