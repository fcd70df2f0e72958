package com.phillippitts.servicelog.logging;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.layout.PatternLayout;

import java.util.Objects;

/**
 * Log4j2 appender that redirects events into a {@link ServiceLogger}.
 *
 * <p>Each event is rendered with a {@code %m%n} pattern and passed to
 * {@link ServiceLogger#write(byte[])}, so it arrives as a WARNING record regardless of its
 * Log4j2 level. Attach it with {@link #attachToRoot(ServiceLogger)}.
 */
public final class ServiceLoggerAppender extends AbstractAppender {

    private static final Logger LOG = LogManager.getLogger(ServiceLoggerAppender.class);

    public static final String NAME = "ServiceLogger";

    private final ServiceLogger target;
    private volatile org.apache.logging.log4j.core.Logger attachedTo;

    ServiceLoggerAppender(String name, ServiceLogger target) {
        super(name, null, PatternLayout.newBuilder().withPattern("%m%n").build(), true, Property.EMPTY_ARRAY);
        this.target = Objects.requireNonNull(target, "target");
    }

    /**
     * Creates, starts and attaches an appender to the root logger of the current Log4j2 context.
     */
    public static ServiceLoggerAppender attachToRoot(ServiceLogger target) {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        return attachTo(context.getRootLogger(), target);
    }

    /**
     * Creates, starts and attaches an appender to {@code logger}.
     */
    public static ServiceLoggerAppender attachTo(org.apache.logging.log4j.core.Logger logger, ServiceLogger target) {
        ServiceLoggerAppender appender = new ServiceLoggerAppender(NAME, target);
        appender.start();
        logger.addAppender(appender);
        appender.attachedTo = logger;
        LOG.info("Redirecting Log4j2 logger '{}' into service log for {}", logger.getName(), target.serviceName());
        return appender;
    }

    /**
     * Removes this appender from the logger it was attached to and stops it.
     * May be called from a thread other than the one that attached it.
     */
    public synchronized void detach() {
        if (attachedTo != null) {
            attachedTo.removeAppender(this);
            attachedTo = null;
        }
        stop();
    }

    @Override
    public void append(LogEvent event) {
        target.write(getLayout().toByteArray(event));
    }
}
