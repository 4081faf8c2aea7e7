package tech.noetzold.waf_api.service.adapt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import tech.noetzold.waf_api.client.EngineException;
import tech.noetzold.waf_api.model.RuleVersion;
import tech.noetzold.waf_api.util.JsonSpans;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code {analysis, fast_prompt, deep_prompt, new_patterns[]}} out of a generator reply.
 */
@Component
public class RuleUpdateParser {

    private final ObjectMapper objectMapper;

    public RuleUpdateParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param previous rules in effect; a blank prompt in the reply keeps the previous text
     * @throws EngineException with {@code PARSE_ERROR} when no object decodes or both prompts are blank
     */
    public RuleUpdate parse(String text, RuleVersion previous) {
        String span = JsonSpans.firstObject(text).orElseThrow(() ->
                new EngineException(EngineException.ErrorType.PARSE_ERROR, "Rule update reply holds no JSON object"));

        JsonNode node;
        try {
            node = objectMapper.readTree(span);
        } catch (JsonProcessingException e) {
            throw new EngineException(EngineException.ErrorType.PARSE_ERROR,
                    "Rule update reply is not valid JSON: " + e.getOriginalMessage(), e);
        }

        String fast = text(node, "fast_prompt");
        String deep = text(node, "deep_prompt");
        if (fast.isBlank() && deep.isBlank()) {
            throw new EngineException(EngineException.ErrorType.PARSE_ERROR, "Rule update carries no prompts");
        }

        List<String> patterns = new ArrayList<>();
        for (JsonNode p : node.path("new_patterns")) {
            if ((p.isTextual() || p.isNumber()) && !p.asText().isBlank()) {
                patterns.add(p.asText());
            }
        }

        return new RuleUpdate(
                text(node, "analysis"),
                fast.isBlank() ? previous.getFastPrompt() : fast,
                deep.isBlank() ? previous.getDeepPrompt() : deep,
                patterns);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || !value.isTextual() ? "" : value.asText();
    }
}
