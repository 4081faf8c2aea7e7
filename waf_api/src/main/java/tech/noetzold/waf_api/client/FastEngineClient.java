package tech.noetzold.waf_api.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions endpoint used as the Stage 1 classifier.
 */
@Component
public class FastEngineClient extends AbstractEngineClient {

    public FastEngineClient(@Qualifier("fastEngineWebClient") WebClient fastEngineWebClient,
                            @Value("${waf.engines.fast.api-key:}") String apiKey,
                            @Value("${waf.engines.fast.name:crusoe}") String name,
                            @Value("${waf.engines.fast.model:meta-llama/Meta-Llama-3.1-8B-Instruct}") String model,
                            @Value("${waf.engines.fast.timeout-ms:15000}") long timeoutMs) {
        super(fastEngineWebClient, apiKey, name, model, timeoutMs);
    }

    @Override
    protected String path() {
        return "/chat/completions";
    }

    @Override
    protected Map<String, Object> buildPayload(String systemPrompt, String userMessage, int maxTokens) {
        return Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userMessage)),
                "temperature", 0.0,
                "max_tokens", maxTokens
        );
    }

    @Override
    protected String extractText(JsonNode body) {
        // {"choices": [{"message": {"content": "..."}}]}
        JsonNode content = body.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new EngineException(EngineException.ErrorType.PARSE_ERROR, name() + " response has no choices");
        }
        return content.asText();
    }
}
