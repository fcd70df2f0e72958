package com.phillippitts.servicelog.logging;

import java.util.Objects;

/**
 * One ECS-shaped log record, as handed to a {@link LogRecordSerializer}.
 *
 * <p>The optional blocks ({@code client}, {@code network}, {@code trace}) are null when the
 * data they describe was not available; serializers omit them entirely in that case.
 *
 * @param timestamp RFC3339 emission time
 * @param message   fully formatted message text
 * @param level     severity; rendered as {@code log.level}
 * @param service   static identity of the emitting process
 * @param client    peer address of the request being handled, or null
 * @param network   forwarded-for address observed on the request, or null
 * @param trace     request id observed on the request, or null
 */
public record LogRecord(
        String timestamp,
        String message,
        Level level,
        Service service,
        Client client,
        Network network,
        Trace trace
) {

    public LogRecord {
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(message, "Message must not be null");
        Objects.requireNonNull(level, "Level must not be null");
        Objects.requireNonNull(service, "Service must not be null");
    }

    /**
     * Creates a record without any request-derived blocks.
     */
    public static LogRecord basic(String timestamp, String message, Level level, Service service) {
        return new LogRecord(timestamp, message, level, service, null, null, null);
    }

    /**
     * {@code service.*}: name is required, type is optional.
     */
    public record Service(String name, String type) {
        public Service {
            Objects.requireNonNull(name, "Service name must not be null");
        }
    }

    /** {@code client.*} */
    public record Client(String ip, String port) {
    }

    /** {@code network.forwarded_ip} */
    public record Network(String forwardedIp) {
    }

    /** {@code trace.id} */
    public record Trace(String id) {
    }
}
