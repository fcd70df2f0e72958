package com.phillippitts.servicelog.web;

import com.phillippitts.servicelog.metrics.RequestMetrics;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.util.Objects;

/**
 * Counts each HTTP request and observes its duration, both labeled by response status and method.
 *
 * <p>Metrics are recorded only when the downstream chain returns normally; if it throws, the
 * exception propagates and nothing is recorded. This filter does not log.
 */
public class RequestMetricsFilter implements Filter {

    private final RequestMetrics metrics;

    public RequestMetricsFilter(RequestMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http) || !(response instanceof HttpServletResponse httpResponse)) {
            chain.doFilter(request, response);
            return;
        }

        long start = System.nanoTime();
        StatusObservingResponse observer = new StatusObservingResponse(httpResponse);

        chain.doFilter(request, observer);

        long durationNanos = System.nanoTime() - start;
        int status = observer.getStatus();
        metrics.observeDuration(status, http.getMethod(), durationNanos);
        metrics.countRequest(status, http.getMethod());
    }
}
