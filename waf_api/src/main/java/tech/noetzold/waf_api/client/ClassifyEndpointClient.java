package tech.noetzold.waf_api.client;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.ratelimit.InternalCallerToken;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Fires raw requests at the externally reachable classify endpoint, the same path live
 * traffic takes. Carries the internal caller token so self-tests are not rate limited.
 */
@Component
public class ClassifyEndpointClient {

    private final WebClient webClient;
    private final InternalCallerToken callerToken;
    private final String endpointUrl;
    private final Duration timeout;

    public ClassifyEndpointClient(@Qualifier("classifyWebClient") WebClient classifyWebClient,
                                  InternalCallerToken callerToken,
                                  @Value("${waf.classify.endpoint-url:http://localhost:${server.port:8080}/v1/classify}") String endpointUrl,
                                  @Value("${waf.redteam.timeout-ms:30000}") long timeoutMs) {
        this.webClient = classifyWebClient;
        this.callerToken = callerToken;
        this.endpointUrl = endpointUrl;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    /**
     * @throws ClassifyCallException on non-2xx replies, timeouts and transport errors
     */
    public ClassificationVerdict classify(String rawRequest) {
        ClassificationVerdict verdict = webClient.post()
                .uri(endpointUrl)
                .header(InternalCallerToken.HEADER, callerToken.value())
                .bodyValue(Map.of("message", rawRequest))
                .exchangeToMono(resp -> {
                    HttpStatusCode status = resp.statusCode();
                    if (status.is2xxSuccessful()) {
                        return resp.bodyToMono(ClassificationVerdict.class);
                    }
                    return resp.releaseBody()
                            .then(Mono.error(new ClassifyCallException("HTTP " + status.value())));
                })
                .timeout(timeout)
                .onErrorMap(TimeoutException.class,
                        e -> new ClassifyCallException("timed out after " + timeout.toMillis() + "ms", e))
                .onErrorMap(e -> !(e instanceof ClassifyCallException),
                        e -> new ClassifyCallException(e.getMessage(), e))
                .block();
        if (verdict == null || verdict.getClassification() == null) {
            throw new ClassifyCallException("empty classify response");
        }
        return verdict;
    }
}
