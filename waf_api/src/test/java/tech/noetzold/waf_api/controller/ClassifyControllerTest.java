package tech.noetzold.waf_api.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import tech.noetzold.waf_api.model.Classification;
import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.ratelimit.InternalCallerToken;
import tech.noetzold.waf_api.ratelimit.RateLimitExceededException;
import tech.noetzold.waf_api.ratelimit.SlidingWindowRateLimiter;
import tech.noetzold.waf_api.service.classify.ClassificationPipeline;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ClassifyController.class)
@DisplayName("ClassifyController Web Tests")
class ClassifyControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ClassificationPipeline pipeline;

    @MockBean
    private SlidingWindowRateLimiter rateLimiter;

    @MockBean
    private InternalCallerToken callerToken;

    @Test
    @DisplayName("Should return the pipeline verdict in wire form")
    void shouldClassify() throws Exception {
        // Given
        when(pipeline.classify("GET /?id=1' OR 1=1 -- HTTP/1.1")).thenReturn(ClassificationVerdict.builder()
                .classification(Classification.MALICIOUS).confidence(0.95).attack_type("sqli")
                .reason("Detected SQL injection (2 patterns matched)").classifier("regex")
                .blocked(true).rules_version(3).build());

        // When / Then
        mvc.perform(post("/v1/classify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"GET /?id=1' OR 1=1 -- HTTP/1.1\"}"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Trace-Id"))
                .andExpect(jsonPath("$.classification").value("MALICIOUS"))
                .andExpect(jsonPath("$.attack_type").value("sqli"))
                .andExpect(jsonPath("$.blocked").value(true))
                .andExpect(jsonPath("$.rules_version").value(3));
        verify(rateLimiter).acquire(eq("classify"), anyString());
    }

    @Test
    @DisplayName("Should reject a blank message with 400")
    void shouldRejectBlankMessage() throws Exception {
        // When / Then
        mvc.perform(post("/v1/classify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("Should answer 429 with Retry-After when the bucket is exhausted")
    void shouldRateLimit() throws Exception {
        // Given
        doThrow(new RateLimitExceededException("classify", 60)).when(rateLimiter).acquire(eq("classify"), anyString());

        // When / Then
        mvc.perform(post("/v1/classify").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"GET / HTTP/1.1\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "60"))
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.retry_after_seconds").value(60));
        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("Should let internal self-test calls skip the limiter")
    void shouldSkipLimiterForInternalCaller() throws Exception {
        // Given
        when(callerToken.matches("internal-secret")).thenReturn(true);
        when(pipeline.classify(anyString())).thenReturn(ClassificationVerdict.builder()
                .classification(Classification.SAFE).confidence(0.85).attack_type("none").classifier("regex").build());

        // When / Then
        mvc.perform(post("/v1/classify").contentType(MediaType.APPLICATION_JSON)
                        .header(InternalCallerToken.HEADER, "internal-secret")
                        .content("{\"message\":\"GET / HTTP/1.1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.classification").value("SAFE"));
        verify(rateLimiter, never()).acquire(anyString(), anyString());
    }

    @Test
    @DisplayName("Should format an inspected request and report PASS or BLOCKED")
    void shouldInspect() throws Exception {
        // Given
        when(pipeline.classify(anyString())).thenReturn(ClassificationVerdict.builder()
                .classification(Classification.MALICIOUS).confidence(0.9).attack_type("xss")
                .classifier("regex").blocked(true).build());

        // When / Then
        mvc.perform(post("/v1/inspect").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"method\":\"GET\",\"path\":\"/search\",\"query_params\":{\"q\":\"<script>\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verdict").value("BLOCKED"));
        verify(pipeline).classify(startsWith("GET /search?"));
    }
}
