package com.beacon.dashboard.web;

import com.beacon.dashboard.service.TrafficCounters;
import com.beacon.database.RequestLogEntry;
import com.beacon.database.RequestLogRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Counts every request before it is handled and logs it to the {@code requests} table.
 *
 * <p>The database write is best-effort: when PostgreSQL is down the failure is logged at DEBUG and
 * the request proceeds. Actuator endpoints are not counted.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTrackingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestTrackingFilter.class);

    static final String ACTUATOR_PREFIX = "/actuator";

    private final TrafficCounters counters;
    private final RequestLogRepository requestLog;

    public RequestTrackingFilter(TrafficCounters counters, RequestLogRepository requestLog) {
        this.counters = counters;
        this.requestLog = requestLog;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.equals(ACTUATOR_PREFIX) || path.startsWith(ACTUATOR_PREFIX + "/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        counters.recordRequest();
        logRequest(request);
        filterChain.doFilter(request, response);
    }

    private void logRequest(HttpServletRequest request) {
        RequestLogEntry entry = new RequestLogEntry(
                request.getRequestURI(), request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT));
        try {
            requestLog.record(entry);
        } catch (RuntimeException e) {
            log.debug("Request log write skipped: {}", e.getMessage());
        }
    }
}
