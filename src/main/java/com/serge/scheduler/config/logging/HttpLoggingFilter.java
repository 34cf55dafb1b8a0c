package com.serge.scheduler.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * One access-log line per HTTP request with status, duration and the correlation id. Bodies are
 * never logged since GraphQL payloads carry passwords and tokens.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class HttpLoggingFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(HttpLoggingFilter.class);
    private static final String START_ATTR = HttpLoggingFilter.class.getName() + ".start";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (request.getAttribute(START_ATTR) == null) {
            request.setAttribute(START_ATTR, System.currentTimeMillis());
        }
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("http_request.failed method={} path={}", request.getMethod(), request.getRequestURI(), e);
            throw e;
        } finally {
            // async handlers finish on a later dispatch, which logs instead
            if (!isAsyncStarted(request)) {
                logLine(request, response);
            }
        }
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    private static void logLine(HttpServletRequest request, HttpServletResponse response) {
        long durationMs = System.currentTimeMillis() - (Long) request.getAttribute(START_ATTR);
        String qs = request.getQueryString();
        String ip = Optional.ofNullable(request.getHeader("X-Forwarded-For")).orElseGet(request::getRemoteAddr);
        String ua = Optional.ofNullable(request.getHeader("User-Agent")).orElse("-");
        log.info("http_request method={} path={} query={} status={} duration_ms={} request_id={} ip={} ua=\"{}\"",
                request.getMethod(),
                request.getRequestURI(),
                qs == null ? "-" : qs,
                response.getStatus(),
                durationMs,
                request.getAttribute(RequestIdFilter.MDC_KEY),
                ip,
                ua.replace('"', ' '));
    }
}
