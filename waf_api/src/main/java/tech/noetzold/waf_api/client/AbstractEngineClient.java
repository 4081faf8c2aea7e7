package tech.noetzold.waf_api.client;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Shared exchange logic for the engine clients: status mapping, timeout and
 * the blocking bridge. Subclasses only shape the request and pick the text out of the reply.
 */
public abstract class AbstractEngineClient implements LanguageEngine {

    private final WebClient webClient;
    private final String apiKey;
    private final String name;
    protected final String model;
    private final Duration timeout;

    protected AbstractEngineClient(WebClient webClient, String apiKey, String name, String model, long timeoutMs) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.name = name;
        this.model = model;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String complete(String systemPrompt, String userMessage, int maxTokens) {
        if (!isConfigured()) {
            throw new EngineException(EngineException.ErrorType.NOT_CONFIGURED, name + " engine has no API key");
        }
        JsonNode body = post(buildPayload(systemPrompt, userMessage, maxTokens));
        String text = extractText(body);
        if (text == null || text.isBlank()) {
            throw new EngineException(EngineException.ErrorType.PARSE_ERROR, name + " returned an empty completion");
        }
        return text.trim();
    }

    protected abstract String path();

    protected abstract Map<String, Object> buildPayload(String systemPrompt, String userMessage, int maxTokens);

    protected abstract String extractText(JsonNode body);

    private JsonNode post(Map<String, Object> payload) {
        JsonNode node = webClient.post()
                .uri(path())
                .bodyValue(payload)
                .exchangeToMono(resp -> {
                    HttpStatusCode status = resp.statusCode();
                    if (status.is2xxSuccessful()) {
                        return resp.bodyToMono(JsonNode.class);
                    }
                    return resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(errorBody -> Mono.error(statusError(status, errorBody)));
                })
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new EngineException(EngineException.ErrorType.TIMEOUT,
                        name + " timed out after " + timeout.toMillis() + "ms", e))
                .onErrorMap(WebClientRequestException.class, e -> new EngineException(
                        EngineException.ErrorType.CONNECTION_ERROR, name + " connection failed: " + e.getMessage(), e))
                .onErrorMap(e -> !(e instanceof EngineException), e -> new EngineException(
                        EngineException.ErrorType.PARSE_ERROR, name + " response unreadable: " + e.getMessage(), e))
                .block();
        if (node == null) {
            throw new EngineException(EngineException.ErrorType.PARSE_ERROR, name + " returned no body");
        }
        return node;
    }

    private EngineException statusError(HttpStatusCode status, String body) {
        int code = status.value();
        if (code == HttpStatus.UNAUTHORIZED.value() || code == HttpStatus.FORBIDDEN.value()) {
            return new EngineException(EngineException.ErrorType.AUTH_FAILURE,
                    name + " authentication failed (HTTP " + code + ")");
        }
        if (code == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return new EngineException(EngineException.ErrorType.RATE_LIMITED, name + " rate limited (HTTP 429)");
        }
        return new EngineException(EngineException.ErrorType.CONNECTION_ERROR,
                name + " API error: " + code + " " + truncate(body, 200));
    }

    static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
