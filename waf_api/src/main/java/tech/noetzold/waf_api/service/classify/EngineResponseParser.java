package tech.noetzold.waf_api.service.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import tech.noetzold.waf_api.model.Classification;
import tech.noetzold.waf_api.util.JsonSpans;

import java.util.Optional;

/**
 * Reads {@code {classification, confidence, attack_type, reason}} out of free engine text.
 * The first balanced object wins; anything short of a recognised classification is a failure.
 */
@Component
public class EngineResponseParser {

    private final ObjectMapper objectMapper;

    public EngineResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EngineOutcome parse(String text) {
        Optional<String> span = JsonSpans.firstObject(text);
        if (span.isEmpty()) {
            return new EngineOutcome.ParseFailure("Failed to parse classifier response: no JSON object");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(span.get());
        } catch (JsonProcessingException e) {
            return new EngineOutcome.ParseFailure("Failed to parse classifier response: " + e.getOriginalMessage());
        }

        Optional<Classification> classification = Classification.parse(node.path("classification").asText(null));
        if (classification.isEmpty()) {
            return new EngineOutcome.ParseFailure("Failed to parse classifier response: missing classification");
        }

        double confidence = node.path("confidence").isNumber()
                ? clamp(node.path("confidence").asDouble())
                : EngineResult.DEGRADED_CONFIDENCE;
        String attackType = textOr(node, "attack_type", "none");
        String reason = textOr(node, "reason", "");

        return new EngineOutcome.ParsedVerdict(classification.get(), confidence, attackType, reason);
    }

    private static String textOr(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        String text = value.asText();
        return text.isBlank() ? fallback : text;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return EngineResult.DEGRADED_CONFIDENCE;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
