package tech.noetzold.waf_api.ratelimit;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import tech.noetzold.waf_api.util.ClientAddress;

@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private final SlidingWindowRateLimiter rateLimiter;
    private final InternalCallerToken callerToken;
    private final boolean trustForwarded;

    public RateLimitInterceptor(SlidingWindowRateLimiter rateLimiter,
                                InternalCallerToken callerToken,
                                @Value("${waf.ratelimit.trust-forwarded:false}") boolean trustForwarded) {
        this.rateLimiter = rateLimiter;
        this.callerToken = callerToken;
        this.trustForwarded = trustForwarded;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (callerToken.matches(request.getHeader(InternalCallerToken.HEADER))) {
            return true;
        }
        rateLimiter.acquire(bucketFor(request), ClientAddress.resolve(request, trustForwarded));
        return true;
    }

    static String bucketFor(HttpServletRequest request) {
        String uri = request.getRequestURI();
        if (uri.startsWith("/v1/")) {
            return "classify";
        }
        if ("POST".equalsIgnoreCase(request.getMethod()) && uri.startsWith("/api/agents")) {
            return "agents";
        }
        return "api";
    }
}
