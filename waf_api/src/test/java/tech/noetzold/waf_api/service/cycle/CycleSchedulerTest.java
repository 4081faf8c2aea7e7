package tech.noetzold.waf_api.service.cycle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CycleScheduler Unit Tests")
class CycleSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private CycleOrchestrator orchestrator;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> future;

    private CycleScheduler cycleScheduler;

    @BeforeEach
    void setUp() {
        cycleScheduler = new CycleScheduler(orchestrator, taskScheduler, Clock.fixed(NOW, ZoneOffset.UTC), 5000, 30000);
    }

    @Test
    @DisplayName("Should schedule once with the configured delay and cancel without interrupting")
    void shouldScheduleOnceAndCancel() {
        // Given
        doReturn(future).when(taskScheduler)
                .scheduleWithFixedDelay(any(Runnable.class), eq(NOW.plusSeconds(5)), eq(Duration.ofSeconds(30)));

        // When
        cycleScheduler.start();
        cycleScheduler.start();
        cycleScheduler.stop();

        // Then
        verify(taskScheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), any(Duration.class));
        verify(future).cancel(false);
    }

    @Test
    @DisplayName("Should keep ticking after a failed cycle")
    void shouldSurviveFailedCycle() {
        // Given
        when(orchestrator.runCycle()).thenThrow(new IllegalStateException("database unavailable"));

        // When / Then
        assertThatCode(() -> cycleScheduler.tick()).doesNotThrowAnyException();
        verify(orchestrator).runCycle();
    }
}
