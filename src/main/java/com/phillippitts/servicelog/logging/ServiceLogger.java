package com.phillippitts.servicelog.logging;

import com.phillippitts.servicelog.exception.InvalidLevelException;
import com.phillippitts.servicelog.exception.SerializationException;
import com.phillippitts.servicelog.request.InboundRequest;
import com.phillippitts.servicelog.request.RequestEnrichment;
import org.json.JSONObject;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Leveled logger that writes one ECS-shaped JSON object per line to a {@link LogSink}.
 *
 * <p>Records are built lazily: the message is formatted only after the level has passed the
 * configured minimum, so filtered calls cost no formatting work.
 *
 * <p>A logger also accepts raw bytes through {@link #write(byte[])} (or
 * {@link #asOutputStream()}), which lets a general-purpose log pipeline be redirected into it.
 * Such messages are logged at {@link Level#WARNING}.
 *
 * <p><b>Usage:</b>
 * <pre>
 * ServiceLogger log = ServiceLogger.builder(LogSink.stdout(), "image-service")
 *         .minimumLevel(Level.INFO)
 *         .build();
 * log.info("Loaded %d thumbnails in %d ms", count, elapsed);
 * </pre>
 *
 * <p>Thread-safe: immutable once built, provided the sink tolerates concurrent writes.
 */
public final class ServiceLogger {

    private static final DateTimeFormatter RFC3339 = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final LogSink sink;
    private final LogRecord.Service service;
    private final Level minimumLevel;
    private final Clock clock;
    private final LogRecordSerializer serializer;

    private ServiceLogger(Builder builder, Level minimumLevel) {
        this.sink = builder.sink;
        this.service = new LogRecord.Service(builder.serviceName, builder.serviceType);
        this.minimumLevel = minimumLevel;
        this.clock = builder.clock;
        this.serializer = builder.serializer;
    }

    /**
     * Starts building a logger.
     *
     * @param sink        destination for emitted lines
     * @param serviceName value of {@code service.name}; must not be blank
     */
    public static Builder builder(LogSink sink, String serviceName) {
        return new Builder(sink, serviceName);
    }

    public void debug(String template, Object... args) {
        log(Level.DEBUG, template, args);
    }

    public void info(String template, Object... args) {
        log(Level.INFO, template, args);
    }

    public void warning(String template, Object... args) {
        log(Level.WARNING, template, args);
    }

    public void error(String template, Object... args) {
        log(Level.ERROR, template, args);
    }

    /**
     * Logs at FATAL. Does not terminate the process.
     */
    public void fatal(String template, Object... args) {
        log(Level.FATAL, template, args);
    }

    public void log(Level level, String template, Object... args) {
        emit(level, effective -> LogRecord.basic(timestamp(), MessageFormatter.format(template, args),
                effective, service));
    }

    /**
     * Logs at a level given by rank. An out-of-range rank is reported and logged at ERROR.
     */
    public void log(int levelRank, String template, Object... args) {
        log(resolveLevel(levelRank), template, args);
    }

    /**
     * Logs {@code bytes} as one WARNING message, with a single trailing newline removed.
     * The text is not treated as a format template.
     *
     * @return the number of bytes consumed, always {@code bytes.length}
     */
    public int write(byte[] bytes) {
        return write(bytes, 0, bytes.length);
    }

    /**
     * Logs {@code length} bytes starting at {@code offset}, as {@link #write(byte[])} does.
     *
     * @return {@code length}
     */
    public int write(byte[] bytes, int offset, int length) {
        String raw = new String(bytes, offset, length, StandardCharsets.UTF_8);
        String message = raw.endsWith("\n") ? raw.substring(0, raw.length() - 1) : raw;
        emit(Level.WARNING, effective -> LogRecord.basic(timestamp(), message, effective, service));
        return length;
    }

    /**
     * Returns a stream that logs every completed line written to it through {@link #write(byte[])}.
     * Suitable for wrapping in a {@link java.io.PrintStream}.
     */
    public OutputStream asOutputStream() {
        return new LineOutputStream(this);
    }

    /**
     * Derives a logger scoped to one inbound request.
     *
     * <p>The request id, peer address and forwarded-for header are captured now and attached
     * to every record the scoped logger emits. A peer address that cannot be parsed is
     * reported at ERROR through this logger; the scope is still created, without client fields.
     */
    public ScopedLogger forRequest(InboundRequest request) {
        RequestEnrichment enrichment = RequestEnrichment.from(request);
        enrichment.addressFailure().ifPresent(address ->
                error("Unable to parse \"%s\" as IP:port", address));
        return new ScopedLogger(this, enrichment);
    }

    /**
     * Emits the record produced by {@code recordFactory} if {@code level} passes the filter.
     *
     * <p>The factory is invoked at most once, and only past the filter. It receives the level
     * actually used, which differs from {@code level} only when that was null: a null level is
     * reported once at ERROR and the record is then emitted at ERROR.
     *
     * <p>If the record cannot be serialized, a minimal fallback line describing the failure is
     * written instead. Nothing is thrown to the caller.
     */
    public void emit(Level level, Function<Level, LogRecord> recordFactory) {
        Level effective = level;
        if (effective == null) {
            reportInvalidLevel("null");
            effective = Level.ERROR;
        }

        if (!effective.isAtLeast(minimumLevel)) {
            return;
        }

        LogRecord record = recordFactory.apply(effective);
        String line;
        try {
            line = serializer.serialize(record);
        } catch (SerializationException e) {
            line = fallbackLine(record, e);
        }
        send(line);
    }

    /**
     * @return true if a record at {@code level} would be written
     */
    public boolean isEnabled(Level level) {
        return level != null && level.isAtLeast(minimumLevel);
    }

    public String serviceName() {
        return service.name();
    }

    public String serviceType() {
        return service.type();
    }

    public Level minimumLevel() {
        return minimumLevel;
    }

    LogRecord.Service service() {
        return service;
    }

    String timestamp() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).format(RFC3339);
    }

    Level resolveLevel(int rank) {
        if (Level.isValid(rank)) {
            return Level.fromRank(rank);
        }
        reportInvalidLevel(String.valueOf(rank));
        return Level.ERROR;
    }

    // Always emits at a valid level, so it cannot re-enter itself.
    private void reportInvalidLevel(String given) {
        emit(Level.ERROR, effective -> LogRecord.basic(timestamp(),
                MessageFormatter.format("Invalid log level specified (%s); This is a bug!", given),
                effective, service));
    }

    private String fallbackLine(LogRecord record, SerializationException e) {
        String detail = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
        return "{\"message\": "
                + JSONObject.quote("Error serializing log message: " + record + " (" + detail + ")")
                + ", \"service\": {\"name\": " + JSONObject.quote(service.name()) + "}}";
    }

    private void send(String line) {
        sink.write((line + "\n").getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Fluent builder for {@link ServiceLogger}. The minimum level is validated in {@link #build()}.
     */
    public static final class Builder {

        private final LogSink sink;
        private final String serviceName;
        private String serviceType;
        private Supplier<Level> minimumLevel = () -> Level.INFO;
        private Clock clock = Clock.systemDefaultZone();
        private LogRecordSerializer serializer = new JsonLogRecordSerializer();

        private Builder(LogSink sink, String serviceName) {
            this.sink = Objects.requireNonNull(sink, "sink must not be null");
            if (serviceName == null || serviceName.isBlank()) {
                throw new IllegalArgumentException("serviceName must not be null or blank");
            }
            this.serviceName = serviceName;
        }

        /**
         * Sets {@code service.type}; null or blank leaves it out of the output.
         */
        public Builder serviceType(String serviceType) {
            this.serviceType = serviceType;
            return this;
        }

        public Builder minimumLevel(Level level) {
            this.minimumLevel = () -> {
                if (level == null) {
                    throw new InvalidLevelException((String) null);
                }
                return level;
            };
            return this;
        }

        public Builder minimumLevel(int rank) {
            this.minimumLevel = () -> Level.fromRank(rank);
            return this;
        }

        public Builder minimumLevel(String name) {
            this.minimumLevel = () -> Level.parse(name);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder serializer(LogRecordSerializer serializer) {
            this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
            return this;
        }

        /**
         * @throws InvalidLevelException if the configured minimum level is not one of the five levels
         */
        public ServiceLogger build() {
            return new ServiceLogger(this, minimumLevel.get());
        }
    }
}
