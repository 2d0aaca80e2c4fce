package com.pocketplan.forecast.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Echoes the caller's {@value #TRACE_HEADER}, or a fresh one, and keeps it in the request context
 * until the response is written.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Request-Trace";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String header = request.getHeader(TRACE_HEADER);
        String traceId = header == null || header.isBlank() ? UUID.randomUUID().toString() : header;
        response.setHeader(TRACE_HEADER, traceId);
        try (RequestContextHolder.Scope ignored = RequestContextHolder.open(traceId)) {
            filterChain.doFilter(request, response);
        }
    }
}
