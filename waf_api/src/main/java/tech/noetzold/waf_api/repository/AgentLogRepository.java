package tech.noetzold.waf_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.waf_api.model.AgentLogEntry;

import java.util.List;

public interface AgentLogRepository extends JpaRepository<AgentLogEntry, Long> {

    long countByAgentAndAction(String agent, String action);

    List<AgentLogEntry> findTop50ByOrderByTimestampDesc();
}
