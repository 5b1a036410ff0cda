package com.phillippitts.tastemodel.config.web;

import com.phillippitts.tastemodel.service.health.ServingRequestStats;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Feeds {@link ServingRequestStats} with the latency and outcome of every API request.
 * A request fails when it throws or answers with a 5xx status. Actuator calls are ignored.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestStatsFilter extends OncePerRequestFilter {

    private final ServingRequestStats stats;

    public RequestStatsFilter(ServingRequestStats stats) {
        this.stats = stats;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        boolean success = false;
        try {
            chain.doFilter(request, response);
            success = response.getStatus() < 500;
        } finally {
            stats.record((System.nanoTime() - start) / 1_000_000.0, success);
        }
    }
}
