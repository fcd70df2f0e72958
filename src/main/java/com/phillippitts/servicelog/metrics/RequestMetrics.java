package com.phillippitts.servicelog.metrics;

/**
 * Metrics backend consumed by {@link com.phillippitts.servicelog.web.RequestMetricsFilter}.
 */
public interface RequestMetrics {

    /**
     * Increments the request counter for (status, method).
     */
    void countRequest(int status, String method);

    /**
     * Records one request duration for (status, method).
     *
     * @param durationNanos elapsed time in nanoseconds
     */
    void observeDuration(int status, String method, long durationNanos);
}
