package tech.noetzold.waf_api.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import tech.noetzold.waf_api.model.StatsResponse;
import tech.noetzold.waf_api.repository.RequestLogRepository;
import tech.noetzold.waf_api.repository.TechniqueRepository;

@Service
@RequiredArgsConstructor
public class StatsService {

    private final RequestLogRepository requestLogRepository;
    private final TechniqueRepository techniqueRepository;
    private final RuleStore ruleStore;

    public StatsResponse current() {
        long threats = techniqueRepository.count();
        long threatsBlocked = techniqueRepository.countByBlockedTrue();
        // percentage of catalogued techniques currently blocked, one decimal
        double blockRate = Math.round(threatsBlocked * 1000.0 / Math.max(threats, 1)) / 10.0;
        return StatsResponse.builder()
                .total_requests(requestLogRepository.count())
                .blocked_requests(requestLogRepository.countByBlockedTrue())
                .total_threats(threats)
                .threats_blocked(threatsBlocked)
                .block_rate(blockRate)
                .rules_version(ruleStore.current().getVersion())
                .build();
    }
}
