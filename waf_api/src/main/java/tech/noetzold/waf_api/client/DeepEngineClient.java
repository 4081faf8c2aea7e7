package tech.noetzold.waf_api.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API. Serves as the Stage 2 classifier and as the generator behind
 * Scout (technique candidates) and Adapt (rule rewrites).
 */
@Component
public class DeepEngineClient extends AbstractEngineClient {

    public DeepEngineClient(@Qualifier("deepEngineWebClient") WebClient deepEngineWebClient,
                            @Value("${waf.engines.deep.api-key:}") String apiKey,
                            @Value("${waf.engines.deep.name:claude}") String name,
                            @Value("${waf.engines.deep.model:claude-sonnet-4-5}") String model,
                            @Value("${waf.engines.deep.timeout-ms:60000}") long timeoutMs) {
        super(deepEngineWebClient, apiKey, name, model, timeoutMs);
    }

    @Override
    protected String path() {
        return "/v1/messages";
    }

    @Override
    protected Map<String, Object> buildPayload(String systemPrompt, String userMessage, int maxTokens) {
        return Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "system", systemPrompt,
                "messages", List.of(Map.of("role", "user", "content", userMessage))
        );
    }

    @Override
    protected String extractText(JsonNode body) {
        // {"content": [{"type": "text", "text": "..."}]}
        JsonNode content = body.path("content");
        if (!content.isArray() || content.isEmpty()) {
            throw new EngineException(EngineException.ErrorType.PARSE_ERROR, name() + " response has no content array");
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                sb.append(block.path("text").asText());
            }
        }
        return sb.toString();
    }
}
