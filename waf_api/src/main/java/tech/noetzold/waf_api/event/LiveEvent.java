package tech.noetzold.waf_api.event;

import lombok.*;

import java.util.Map;

/**
 * Fire-and-forget dashboard notification. {@code type} is one of
 * {@code agent}, {@code stats}, {@code request} or {@code system}.
 * The factories leave {@code timestamp} unset; {@code LiveEventService} stamps it from the shared clock.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LiveEvent {
    private String type;
    private String agent;
    private String status;
    private String detail;
    private Map<String, Object> data;
    private long timestamp;

    public static LiveEvent agent(String agent, String status, String detail) {
        return LiveEvent.builder()
                .type("agent")
                .agent(agent)
                .status(status)
                .detail(detail)
                .build();
    }

    public static LiveEvent systemError(String detail) {
        return LiveEvent.builder()
                .type("system")
                .agent("system")
                .status("error")
                .detail(detail)
                .build();
    }

    public static LiveEvent stats(Map<String, Object> stats) {
        return LiveEvent.builder()
                .type("stats")
                .data(stats)
                .build();
    }

    public static LiveEvent request(Map<String, Object> request) {
        return LiveEvent.builder()
                .type("request")
                .data(request)
                .build();
    }
}
