package com.hermes.api.rest;

import com.hermes.engine.logging.LoggingContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Gives every request a trace ID for log correlation. A caller-supplied
 * {@code X-Request-Id} is reused; the ID is echoed on the response.
 */
@Component
public class RequestTraceFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        LoggingContext.setTraceId(request.getHeader(REQUEST_ID_HEADER));
        response.setHeader(REQUEST_ID_HEADER, LoggingContext.ensureTraceId());
        try {
            chain.doFilter(request, response);
        } finally {
            LoggingContext.clearAll();
        }
    }
}
