package tech.noetzold.waf_api;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import tech.noetzold.waf_api.util.ClientAddress;

import java.io.IOException;

/**
 * Tags every request with a trace id (MDC key {@code trace_id}, echoed as {@code X-Trace-Id})
 * and logs method, URI, status and latency.
 */
@Component
@Order(1)
public class RequestTraceFilter implements Filter {

    private static final Logger logger = LoggerFactory.getLogger(RequestTraceFilter.class);

    public static final String TRACE_ID = "trace_id";

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) req;
        HttpServletResponse httpResponse = (HttpServletResponse) res;

        long startTime = System.currentTimeMillis();
        String traceId = generateTraceId();
        MDC.put(TRACE_ID, traceId);
        httpResponse.setHeader("X-Trace-Id", traceId);

        try {
            chain.doFilter(req, res);
        } finally {
            long processingTime = System.currentTimeMillis() - startTime;
            logger.info("{} {} -> {} from {} in {}ms", httpRequest.getMethod(), httpRequest.getRequestURI(),
                    httpResponse.getStatus(), ClientAddress.resolve(httpRequest, false), processingTime);
            MDC.remove(TRACE_ID);
        }
    }

    private String generateTraceId() {
        return "req_" + System.currentTimeMillis() + "_" +
                Integer.toHexString((int) (Math.random() * 0xFFFF));
    }
}
