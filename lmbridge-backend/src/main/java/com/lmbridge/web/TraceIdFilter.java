package com.lmbridge.web;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Binds a trace id to the request: taken from {@code X-Request-Id} or generated, echoed back in
 * the response and kept in the MDC while the request runs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter implements Filter {

    public static final String TRACE_ID_HEADER = "X-Request-Id";
    public static final String MDC_TRACE_ID = "trace_id";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        String previous = MDC.get(MDC_TRACE_ID);
        if (request instanceof HttpServletRequest httpRequest) {
            String traceId = httpRequest.getHeader(TRACE_ID_HEADER);
            if (traceId == null || traceId.isBlank()) {
                traceId = UUID.randomUUID().toString();
            }
            MDC.put(MDC_TRACE_ID, traceId.trim());
            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(TRACE_ID_HEADER, traceId.trim());
            }
        }

        try {
            chain.doFilter(request, response);
        } finally {
            if (previous != null) {
                MDC.put(MDC_TRACE_ID, previous);
            } else {
                MDC.remove(MDC_TRACE_ID);
            }
        }
    }
}
