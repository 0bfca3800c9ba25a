package br.fluitax.common.infrastructure;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Adds and propagates X-Request-Id and attaches it to logs via MDC, so the lines of one
 * report build (fetch, extraction, ledger, export) can be grouped.
 *
 * The access line names the rendering that was served (JSON, CSV or XLSX) and report
 * builds slower than {@link #SLOW_REQUEST_MS} are logged at WARN.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_KEY = "requestId";
    static final long SLOW_REQUEST_MS = 10_000;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws IOException, ServletException {
        String requestId = request.getHeader(HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }

        long startNs = System.nanoTime();
        MDC.put(MDC_KEY, requestId);
        response.setHeader(HEADER, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            long durationMs = (System.nanoTime() - startNs) / 1_000_000;
            String line = accessLine(request, response);
            if (durationMs > SLOW_REQUEST_MS) {
                log.warn("Slow request: {} ({}ms)", line, durationMs);
            } else {
                log.info("{} ({}ms)", line, durationMs);
            }
            MDC.remove(MDC_KEY);
        }
    }

    static String accessLine(HttpServletRequest request, HttpServletResponse response) {
        String qs = request.getQueryString();
        String path = request.getRequestURI() + (qs != null ? "?" + qs : "");
        String contentType = response.getContentType();
        return request.getMethod() + " " + path + " -> " + response.getStatus()
                + (contentType != null ? " [" + contentType + "]" : "");
    }
}
