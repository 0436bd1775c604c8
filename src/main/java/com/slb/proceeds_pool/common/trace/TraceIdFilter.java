package com.slb.proceeds_pool.common.trace;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Ensures every request and response carries an {@code X-Trace-Id}; the id is also visible to log lines.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String supplied = request.getHeader(TraceIdHolder.TRACE_ID_HEADER);
        String traceId = StringUtils.hasText(supplied) ? supplied.trim() : TraceIdHolder.newTraceId();

        TraceIdHolder.set(traceId);
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            TraceIdHolder.clear();
        }
    }
}
