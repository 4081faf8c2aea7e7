package tech.noetzold.waf_api.service.scout;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import tech.noetzold.waf_api.client.EngineException;
import tech.noetzold.waf_api.model.TechniqueCandidate;
import tech.noetzold.waf_api.util.JsonSpans;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts technique candidates from a generator reply. Elements that are not objects or lack a
 * name or payload are dropped here, before deduplication.
 */
@Component
public class CandidateParser {

    private final ObjectMapper objectMapper;

    public CandidateParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws EngineException with {@code PARSE_ERROR} when the reply holds no decodable JSON array
     */
    public List<TechniqueCandidate> parse(String text) {
        String span = JsonSpans.firstArray(text).orElseThrow(() ->
                new EngineException(EngineException.ErrorType.PARSE_ERROR, "Generator reply holds no JSON array"));

        JsonNode array;
        try {
            array = objectMapper.readTree(span);
        } catch (JsonProcessingException e) {
            throw new EngineException(EngineException.ErrorType.PARSE_ERROR,
                    "Generator reply is not valid JSON: " + e.getOriginalMessage(), e);
        }

        List<TechniqueCandidate> candidates = new ArrayList<>();
        for (JsonNode node : array) {
            if (!node.isObject()) continue;
            TechniqueCandidate candidate = new TechniqueCandidate(
                    text(node, "technique_name"),
                    text(node, "category"),
                    text(node, "raw_payload"),
                    text(node, "severity"),
                    null);
            if (candidate.isComplete()) {
                candidates.add(candidate);
            }
        }
        return candidates;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.isContainerNode() ? null : value.asText();
    }
}
