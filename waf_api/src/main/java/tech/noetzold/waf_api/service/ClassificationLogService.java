package tech.noetzold.waf_api.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.waf_api.event.LiveEvent;
import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.model.RequestLogEntry;
import tech.noetzold.waf_api.repository.RequestLogRepository;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClassificationLogService {

    static final int EXCERPT_LENGTH = 500;

    private final RequestLogRepository requestLogRepository;
    private final LiveEventService liveEventService;
    private final Clock clock;

    /**
     * Writes the request log row and emits the matching live event. A failed write is
     * logged and does not cost the caller its verdict.
     */
    public void record(String rawRequest, ClassificationVerdict verdict) {
        String excerpt = excerpt(rawRequest);
        try {
            requestLogRepository.save(RequestLogEntry.builder()
                    .timestamp(clock.instant())
                    .rawRequest(excerpt)
                    .classification(verdict.getClassification())
                    .confidence(verdict.getConfidence())
                    .classifier(verdict.getClassifier())
                    .blocked(verdict.isBlocked())
                    .attackType(verdict.getAttack_type())
                    .responseTimeMs(verdict.getResponse_time_ms())
                    .rulesVersion(verdict.getRules_version())
                    .build());
        } catch (Exception e) {
            log.error("Error writing request log for {} verdict: {}", verdict.getClassification(), e.getMessage(), e);
        }

        Map<String, Object> data = new HashMap<>();
        data.put("raw_request", excerpt);
        data.put("classification", verdict.getClassification());
        data.put("confidence", verdict.getConfidence());
        data.put("classifier", verdict.getClassifier());
        data.put("blocked", verdict.isBlocked());
        data.put("attack_type", verdict.getAttack_type());
        data.put("response_time_ms", verdict.getResponse_time_ms());
        data.put("rules_version", verdict.getRules_version());
        liveEventService.publish(LiveEvent.request(data));
    }

    public List<RequestLogEntry> recent() {
        return requestLogRepository.findTop100ByOrderByTimestampDesc();
    }

    static String excerpt(String rawRequest) {
        if (rawRequest == null) return "";
        return rawRequest.length() <= EXCERPT_LENGTH ? rawRequest : rawRequest.substring(0, EXCERPT_LENGTH);
    }
}
