package com.phillippitts.servicelog.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the service logger.
 * Binds to properties prefixed with "servicelog".
 *
 * <p>Example application.properties:
 * <pre>
 * servicelog.service-name=image-service
 * servicelog.service-type=thumbnailer
 * servicelog.level=INFO
 * servicelog.target=STDOUT
 * servicelog.capture-log4j=false
 * servicelog.connection-label=Cassandra
 * servicelog.metrics.enabled=true
 * </pre>
 *
 * @param serviceName  value of service.name in every record
 * @param serviceType  value of service.type; omitted when blank
 * @param level        minimum level name (DEBUG, INFO, WARNING, ERROR, FATAL)
 * @param target       stream the log lines go to
 * @param captureLog4j redirect Log4j2 root logger output into the service log
 * @param connectionLabel prefix of connection event messages, naming the data store
 * @param metrics      request instrumentation settings
 */
@ConfigurationProperties(prefix = "servicelog")
@Validated
public record ServiceLogProperties(
        @NotBlank(message = "Service name must not be blank")
        String serviceName,

        String serviceType,

        @DefaultValue("INFO")
        @NotBlank(message = "Log level must not be blank")
        String level,

        @DefaultValue("STDOUT")
        @NotNull(message = "Log target must not be null")
        Target target,

        @DefaultValue("false")
        boolean captureLog4j,

        @DefaultValue("Database")
        @NotBlank(message = "Connection label must not be blank")
        String connectionLabel,

        @DefaultValue
        @Valid
        Metrics metrics
) {

    public enum Target {
        STDOUT,
        STDERR
    }

    /**
     * @param enabled         register the request metrics filter
     * @param requestCounter  counter name, tagged by status and method
     * @param requestDuration timer name, tagged by status and method
     */
    public record Metrics(
            @DefaultValue("true")
            boolean enabled,

            @DefaultValue("servicelog.requests")
            @NotBlank(message = "Request counter name must not be blank")
            String requestCounter,

            @DefaultValue("servicelog.request.duration")
            @NotBlank(message = "Request duration name must not be blank")
            String requestDuration
    ) {
    }
}
