package com.barthel.fragility.adapter.in.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Request context for the log lines of one call. Every request gets a trace
 * id, echoed in {@code X-Request-Id}; requests addressing a sector and hazard
 * also carry both in the MDC so engine warnings can be attributed.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTraceFilter extends OncePerRequestFilter {

    static final String TRACE_ID_HEADER = "X-Request-Id";
    static final String MDC_TRACE_ID = "trace_id";
    static final String MDC_SECTOR = "sector";
    static final String MDC_HAZARD = "hazard";

    // caller supplied ids end up in logs and headers
    private static final Pattern ACCEPTED_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private static final List<String> SCOPED_ROUTES = List.of(
            "/api/fragility/*/{sector}/{hazard}",
            "/api/hbom/tree/{sector}/{hazard}");

    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String traceId = traceId(request.getHeader(TRACE_ID_HEADER));
        MDC.put(MDC_TRACE_ID, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);
        scope(request.getRequestURI());

        long started = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            if (MDC.get(MDC_HAZARD) != null) {
                log.info("{} {} finished with status {} in {} ms", request.getMethod(), request.getRequestURI(),
                        response.getStatus(), (System.nanoTime() - started) / 1_000_000);
            }
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_SECTOR);
            MDC.remove(MDC_HAZARD);
        }
    }

    private static String traceId(String supplied) {
        if (supplied != null && ACCEPTED_TRACE_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }

    private void scope(String uri) {
        for (String route : SCOPED_ROUTES) {
            if (pathMatcher.match(route, uri)) {
                Map<String, String> variables = pathMatcher.extractUriTemplateVariables(route, uri);
                MDC.put(MDC_SECTOR, UriUtils.decode(variables.get("sector"), StandardCharsets.UTF_8));
                MDC.put(MDC_HAZARD, UriUtils.decode(variables.get("hazard"), StandardCharsets.UTF_8));
                return;
            }
        }
    }
}
