package tech.noetzold.waf_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.waf_api.model.AgentLogEntry;
import tech.noetzold.waf_api.repository.AgentLogRepository;

import java.time.Clock;
import java.util.List;

/**
 * Append-only audit trail of agent runs. Also the source of the Scout generation
 * number and the cycle counter.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityLogService {

    private final AgentLogRepository agentLogRepository;
    private final Clock clock;

    public AgentLogEntry record(String agent, String action, String detail, boolean success) {
        AgentLogEntry entry = AgentLogEntry.builder()
                .timestamp(clock.instant())
                .agent(agent)
                .action(action)
                .detail(detail)
                .success(success)
                .build();
        log.debug("activity {}/{} success={} {}", agent, action, success, detail);
        return agentLogRepository.save(entry);
    }

    public long count(String agent, String action) {
        return agentLogRepository.countByAgentAndAction(agent, action);
    }

    public List<AgentLogEntry> recent() {
        return agentLogRepository.findTop50ByOrderByTimestampDesc();
    }
}
