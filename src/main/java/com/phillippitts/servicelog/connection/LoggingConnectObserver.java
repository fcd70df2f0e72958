package com.phillippitts.servicelog.connection;

import com.phillippitts.servicelog.logging.ServiceLogger;

import java.util.Objects;

/**
 * {@link ConnectObserver} that logs connection outcomes: failures at ERROR, newly opened
 * connections at DEBUG.
 *
 * <p>Example, for a driver that accepts a connect callback:
 * <pre>
 * ServiceLogger logger = ServiceLogger.builder(LogSink.stdout(), "service").minimumLevel("debug").build();
 * ConnectObserver observer = new LoggingConnectObserver(logger, "Cassandra");
 * driver.onConnect((address, error) -&gt; observer.observeConnect(new ConnectionEvent(address, error)));
 * </pre>
 *
 * <p>Retry and reconnection belong to the connection layer; this class only reports.
 */
public class LoggingConnectObserver implements ConnectObserver {

    private final ServiceLogger logger;
    private final String label;

    /**
     * @param logger destination logger
     * @param label  prefix naming the backend, e.g. "Cassandra"
     */
    public LoggingConnectObserver(ServiceLogger logger, String label) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.label = Objects.requireNonNull(label, "label");
    }

    @Override
    public void observeConnect(ConnectionEvent event) {
        if (event.error() != null) {
            logger.error("%s: Problem connecting to %s, (%s)", label, event.address(), describe(event.error()));
            return;
        }
        logger.debug("%s: Opened new connection to %s", label, event.address());
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getName();
    }
}
