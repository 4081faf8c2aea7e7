package tech.noetzold.waf_api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import tech.noetzold.waf_api.event.LiveEvent;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Dashboard sink. Keeps a bounded in-memory tail of events that {@code GET /api/events} serves.
 */
@Service
public class LiveEventService {

    private static final Logger logger = LoggerFactory.getLogger(LiveEventService.class);

    private final int capacity;
    private final Clock clock;
    private final Deque<LiveEvent> buffer = new ArrayDeque<>();

    public LiveEventService(@Value("${waf.events.buffer-size:200}") int capacity, Clock clock) {
        this.capacity = capacity;
        this.clock = clock;
    }

    @Async("taskExecutor")
    public CompletableFuture<Void> publish(LiveEvent event) {
        try {
            if (event.getTimestamp() == 0) {
                event.setTimestamp(clock.millis());
            }
            synchronized (buffer) {
                buffer.addLast(event);
                while (buffer.size() > capacity) {
                    buffer.pollFirst();
                }
            }
            logger.debug("Live event {} {} {}", event.getType(), event.getAgent(), event.getStatus());
        } catch (Exception e) {
            logger.error("Error publishing live event {}: {}", event.getType(), e.getMessage(), e);
        }
        return CompletableFuture.completedFuture(null);
    }

    /** Newest first. */
    public List<LiveEvent> recent(int limit) {
        List<LiveEvent> out = new ArrayList<>();
        synchronized (buffer) {
            Iterator<LiveEvent> it = buffer.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                out.add(it.next());
            }
        }
        return out;
    }
}
