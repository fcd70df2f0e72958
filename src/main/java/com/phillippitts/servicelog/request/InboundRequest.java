package com.phillippitts.servicelog.request;

/**
 * The parts of an inbound unit of work that request enrichment reads.
 *
 * <p>Implementations adapt a concrete transport (see {@link ServletInboundRequest}).
 */
public interface InboundRequest {

    /**
     * @param name header name (case-insensitive where the transport allows)
     * @return the header value, or null if the header is absent
     */
    String header(String name);

    /**
     * @return the peer address in {@code host:port} form ({@code [host]:port} for IPv6),
     *         or null if the transport does not know it
     */
    String remoteAddress();
}
