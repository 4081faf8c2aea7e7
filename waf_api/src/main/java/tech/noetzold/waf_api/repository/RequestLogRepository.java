package tech.noetzold.waf_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.waf_api.model.RequestLogEntry;

import java.util.List;

public interface RequestLogRepository extends JpaRepository<RequestLogEntry, Long> {

    List<RequestLogEntry> findTop100ByOrderByTimestampDesc();

    long countByBlockedTrue();
}
