package com.phillippitts.servicelog.config;

import com.phillippitts.servicelog.connection.ConnectObserver;
import com.phillippitts.servicelog.connection.LoggingConnectObserver;
import com.phillippitts.servicelog.logging.LogSink;
import com.phillippitts.servicelog.logging.ServiceLogger;
import com.phillippitts.servicelog.logging.ServiceLoggerAppender;
import com.phillippitts.servicelog.metrics.MicrometerRequestMetrics;
import com.phillippitts.servicelog.metrics.RequestMetrics;
import com.phillippitts.servicelog.web.LoggerInjectingFilter;
import com.phillippitts.servicelog.web.RequestMetricsFilter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Wires the service logger and its request-boundary collaborators.
 *
 * <p>Beans:
 * <ul>
 *   <li>{@code logSink} - stdout or stderr, per {@code servicelog.target}</li>
 *   <li>{@code serviceLogger} - the process-wide logger; startup fails on an invalid level</li>
 *   <li>{@code loggerInjectingFilter} - runs first so every handler sees a scoped logger</li>
 *   <li>{@code requestMetricsFilter} - request count and duration (servicelog.metrics.enabled)</li>
 *   <li>{@code connectObserver} - logs connection outcomes for data-store clients</li>
 *   <li>{@code log4jCapture} - optional Log4j2 redirect (servicelog.capture-log4j)</li>
 * </ul>
 */
@Configuration
public class ServiceLogConfig {

    private static final Logger LOG = LogManager.getLogger(ServiceLogConfig.class);

    static final int INJECTING_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE;
    static final int METRICS_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE + 1;

    @Bean
    public LogSink logSink(ServiceLogProperties properties) {
        return properties.target() == ServiceLogProperties.Target.STDERR ? LogSink.stderr() : LogSink.stdout();
    }

    @Bean
    public ServiceLogger serviceLogger(LogSink logSink, ServiceLogProperties properties) {
        ServiceLogger logger = ServiceLogger.builder(logSink, properties.serviceName())
                .serviceType(properties.serviceType())
                .minimumLevel(properties.level())
                .build();
        LOG.info("Service log ready: service={}, type={}, level={}, target={}",
                logger.serviceName(), logger.serviceType(), logger.minimumLevel(), properties.target());
        return logger;
    }

    @Bean
    public FilterRegistrationBean<LoggerInjectingFilter> loggerInjectingFilter(ServiceLogger serviceLogger) {
        FilterRegistrationBean<LoggerInjectingFilter> registration =
                new FilterRegistrationBean<>(new LoggerInjectingFilter(serviceLogger));
        registration.setOrder(INJECTING_FILTER_ORDER);
        return registration;
    }

    @Bean
    @ConditionalOnProperty(prefix = "servicelog.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RequestMetrics requestMetrics(MeterRegistry registry, ServiceLogProperties properties) {
        return new MicrometerRequestMetrics(registry,
                properties.metrics().requestCounter(),
                properties.metrics().requestDuration());
    }

    @Bean
    @ConditionalOnProperty(prefix = "servicelog.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FilterRegistrationBean<RequestMetricsFilter> requestMetricsFilter(RequestMetrics requestMetrics) {
        FilterRegistrationBean<RequestMetricsFilter> registration =
                new FilterRegistrationBean<>(new RequestMetricsFilter(requestMetrics));
        registration.setOrder(METRICS_FILTER_ORDER);
        return registration;
    }

    @Bean
    public ConnectObserver connectObserver(ServiceLogger serviceLogger, ServiceLogProperties properties) {
        return new LoggingConnectObserver(serviceLogger, properties.connectionLabel());
    }

    @Bean(destroyMethod = "detach")
    @ConditionalOnProperty(prefix = "servicelog", name = "capture-log4j", havingValue = "true")
    public ServiceLoggerAppender log4jCapture(ServiceLogger serviceLogger) {
        return ServiceLoggerAppender.attachToRoot(serviceLogger);
    }
}
