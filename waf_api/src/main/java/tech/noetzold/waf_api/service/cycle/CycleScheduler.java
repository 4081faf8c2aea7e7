package tech.noetzold.waf_api.service.cycle;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Background driver. Starts once the web server is up, since Red-Team fires at the own
 * classify endpoint, and runs cycles on a fixed delay until shutdown. A stop only takes effect
 * between cycles.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "waf.cycle.enabled", havingValue = "true", matchIfMissing = true)
public class CycleScheduler {

    private final CycleOrchestrator orchestrator;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration initialDelay;
    private final Duration interval;

    private ScheduledFuture<?> task;

    public CycleScheduler(CycleOrchestrator orchestrator,
                          @Qualifier("cycleScheduler") TaskScheduler scheduler,
                          Clock clock,
                          @Value("${waf.cycle.initial-delay-ms:5000}") long initialDelayMs,
                          @Value("${waf.cycle.interval-ms:30000}") long intervalMs) {
        this.orchestrator = orchestrator;
        this.scheduler = scheduler;
        this.clock = clock;
        this.initialDelay = Duration.ofMillis(initialDelayMs);
        this.interval = Duration.ofMillis(intervalMs);
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (task != null) return;
        task = scheduler.scheduleWithFixedDelay(this::tick, clock.instant().plus(initialDelay), interval);
        log.info("Defense cycle scheduled every {}s after {}s", interval.toSeconds(), initialDelay.toSeconds());
    }

    @PreDestroy
    public synchronized void stop() {
        if (task == null) return;
        task.cancel(false);
        task = null;
        log.info("Defense cycle stopped");
    }

    void tick() {
        try {
            orchestrator.runCycle();
        } catch (RuntimeException e) {
            // already recorded by the orchestrator; keep the schedule alive
            log.warn("Scheduled cycle failed, waiting for next tick: {}", e.getMessage());
        }
    }
}
