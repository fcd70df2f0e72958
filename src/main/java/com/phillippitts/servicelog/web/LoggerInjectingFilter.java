package com.phillippitts.servicelog.web;

import com.phillippitts.servicelog.logging.ScopedLogger;
import com.phillippitts.servicelog.logging.ServiceLogger;
import com.phillippitts.servicelog.request.ServletInboundRequest;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link ScopedLogger} for every HTTP request and exposes it to downstream handlers
 * as a request attribute.
 *
 * <p>Values captured:</p>
 * <ul>
 *   <li>trace.id: from the X-Request-ID header (if present)</li>
 *   <li>client.ip / client.port: from the peer address</li>
 *   <li>network.forwarded_ip: from the X-Forwarded-For header (if present)</li>
 * </ul>
 *
 * <p>The attribute is always removed after the request so a recycled request object never
 * carries a stale logger.</p>
 */
public class LoggerInjectingFilter implements Filter {

    public static final String SCOPED_LOGGER_ATTRIBUTE = ScopedLogger.class.getName();

    private final ServiceLogger logger;

    public LoggerInjectingFilter(ServiceLogger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        try {
            http.setAttribute(SCOPED_LOGGER_ATTRIBUTE, logger.forRequest(ServletInboundRequest.of(http)));
            chain.doFilter(request, response);
        } finally {
            http.removeAttribute(SCOPED_LOGGER_ATTRIBUTE);
        }
    }

    /**
     * @return the scoped logger injected for {@code request}, if this filter ran for it
     */
    public static Optional<ScopedLogger> scopedLogger(ServletRequest request) {
        Object value = request.getAttribute(SCOPED_LOGGER_ATTRIBUTE);
        return value instanceof ScopedLogger scoped ? Optional.of(scoped) : Optional.empty();
    }
}
