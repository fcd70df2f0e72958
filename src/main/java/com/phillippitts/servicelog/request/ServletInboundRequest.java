package com.phillippitts.servicelog.request;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Objects;

/**
 * {@link InboundRequest} view of a Servlet request.
 */
public final class ServletInboundRequest implements InboundRequest {

    private final HttpServletRequest request;

    private ServletInboundRequest(HttpServletRequest request) {
        this.request = Objects.requireNonNull(request, "request");
    }

    public static ServletInboundRequest of(HttpServletRequest request) {
        return new ServletInboundRequest(request);
    }

    @Override
    public String header(String name) {
        return request.getHeader(name);
    }

    /**
     * Joins the peer host and port. A port the container does not know (0 or negative) is
     * left empty, so no {@code client.port} is logged for it.
     */
    @Override
    public String remoteAddress() {
        String host = request.getRemoteAddr();
        if (host == null || host.isEmpty()) {
            return null;
        }
        int port = request.getRemotePort();
        return HostPort.join(host, port > 0 ? String.valueOf(port) : "");
    }
}
