package com.phillippitts.servicelog.logging;

import com.phillippitts.servicelog.request.RequestEnrichment;

import java.util.Objects;
import java.util.Optional;

/**
 * A view of a {@link ServiceLogger} bound to one inbound request.
 *
 * <p>Carries the client, network and trace blocks captured when the scope was created and adds
 * them to every record. Filtering, formatting and writing are delegated to the parent, so a
 * scoped call behaves exactly like a direct one apart from the extra fields.
 *
 * <p>Created per request by {@link ServiceLogger#forRequest} and dropped when the request is done.
 */
public final class ScopedLogger {

    private final ServiceLogger parent;
    private final LogRecord.Client client;
    private final LogRecord.Network network;
    private final LogRecord.Trace trace;

    ScopedLogger(ServiceLogger parent, RequestEnrichment enrichment) {
        this.parent = Objects.requireNonNull(parent, "parent");
        this.client = enrichment.hasClient()
                ? new LogRecord.Client(enrichment.clientIp(), enrichment.clientPort())
                : null;
        this.network = enrichment.forwardedFor() != null
                ? new LogRecord.Network(enrichment.forwardedFor())
                : null;
        this.trace = enrichment.traceId() != null
                ? new LogRecord.Trace(enrichment.traceId())
                : null;
    }

    public void log(Level level, String template, Object... args) {
        parent.emit(level, effective -> new LogRecord(
                parent.timestamp(),
                MessageFormatter.format(template, args),
                effective,
                parent.service(),
                client,
                network,
                trace));
    }

    public void log(int levelRank, String template, Object... args) {
        log(parent.resolveLevel(levelRank), template, args);
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

    public void fatal(String template, Object... args) {
        log(Level.FATAL, template, args);
    }

    public ServiceLogger parent() {
        return parent;
    }

    public Optional<LogRecord.Client> client() {
        return Optional.ofNullable(client);
    }

    public Optional<LogRecord.Network> network() {
        return Optional.ofNullable(network);
    }

    public Optional<LogRecord.Trace> trace() {
        return Optional.ofNullable(trace);
    }
}
