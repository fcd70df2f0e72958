package com.phillippitts.servicelog.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed {@link RequestMetrics}.
 *
 * <p>Registers a counter and a timer (with a percentile histogram) under the names given at
 * construction, both tagged with {@code status} and {@code method}. With the Prometheus registry
 * they are exposed at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
public class MicrometerRequestMetrics implements RequestMetrics {

    public static final String DEFAULT_COUNTER_NAME = "servicelog.requests";
    public static final String DEFAULT_DURATION_NAME = "servicelog.request.duration";

    private final MeterRegistry registry;
    private final String counterName;
    private final String durationName;

    public MicrometerRequestMetrics(MeterRegistry registry) {
        this(registry, DEFAULT_COUNTER_NAME, DEFAULT_DURATION_NAME);
    }

    public MicrometerRequestMetrics(MeterRegistry registry, String counterName, String durationName) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.counterName = Objects.requireNonNull(counterName, "counterName");
        this.durationName = Objects.requireNonNull(durationName, "durationName");
    }

    @Override
    public void countRequest(int status, String method) {
        Counter.builder(counterName)
                .description("Number of HTTP requests handled")
                .tag("status", String.valueOf(status))
                .tag("method", method)
                .register(registry)
                .increment();
    }

    @Override
    public void observeDuration(int status, String method, long durationNanos) {
        Timer.builder(durationName)
                .description("Time taken to handle HTTP requests")
                .tag("status", String.valueOf(status))
                .tag("method", method)
                .publishPercentileHistogram()
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
