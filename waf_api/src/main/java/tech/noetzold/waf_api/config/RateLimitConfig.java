package tech.noetzold.waf_api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.noetzold.waf_api.ratelimit.RateLimitBucket;
import tech.noetzold.waf_api.ratelimit.SlidingWindowRateLimiter;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

@Configuration
public class RateLimitConfig {

    @Bean
    public SlidingWindowRateLimiter slidingWindowRateLimiter(
            Clock clock,
            @Value("${waf.ratelimit.classify.max-requests:30}") int classifyMax,
            @Value("${waf.ratelimit.classify.window-seconds:60}") long classifyWindow,
            @Value("${waf.ratelimit.api.max-requests:60}") int apiMax,
            @Value("${waf.ratelimit.api.window-seconds:60}") long apiWindow,
            @Value("${waf.ratelimit.agents.max-requests:3}") int agentsMax,
            @Value("${waf.ratelimit.agents.window-seconds:300}") long agentsWindow) {
        return new SlidingWindowRateLimiter(Map.of(
                "classify", new RateLimitBucket("classify", classifyMax, Duration.ofSeconds(classifyWindow)),
                "api", new RateLimitBucket("api", apiMax, Duration.ofSeconds(apiWindow)),
                "agents", new RateLimitBucket("agents", agentsMax, Duration.ofSeconds(agentsWindow))
        ), clock);
    }
}
