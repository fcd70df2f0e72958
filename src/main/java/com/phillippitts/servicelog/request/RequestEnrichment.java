package com.phillippitts.servicelog.request;

import com.phillippitts.servicelog.exception.AddressParseException;

import java.util.Optional;

/**
 * Request-derived values that enrich log records: trace id, client address and port,
 * and forwarded-for address. Every value is independently optional.
 *
 * <p>Extraction never fails. A peer address that is present but cannot be parsed is kept
 * in {@link #unparsedAddress()} so the caller can report it.
 *
 * @param traceId         value of {@value #REQUEST_ID_HEADER}, or null
 * @param clientIp        peer host, or null
 * @param clientPort      peer port, or null
 * @param forwardedFor    value of {@value #FORWARDED_FOR_HEADER}, or null
 * @param unparsedAddress peer address that failed to parse, or null
 */
public record RequestEnrichment(
        String traceId,
        String clientIp,
        String clientPort,
        String forwardedFor,
        String unparsedAddress
) {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    public static RequestEnrichment from(InboundRequest request) {
        String traceId = headerOrNull(request, REQUEST_ID_HEADER);
        String forwardedFor = headerOrNull(request, FORWARDED_FOR_HEADER);

        String clientIp = null;
        String clientPort = null;
        String unparsed = null;
        String address = request.remoteAddress();
        if (address != null && !address.isEmpty()) {
            try {
                HostPort peer = HostPort.split(address);
                clientIp = peer.host();
                clientPort = peer.port();
            } catch (AddressParseException e) {
                unparsed = address;
            }
        }
        return new RequestEnrichment(traceId, clientIp, clientPort, forwardedFor, unparsed);
    }

    public boolean hasClient() {
        return clientIp != null;
    }

    public Optional<String> addressFailure() {
        return Optional.ofNullable(unparsedAddress);
    }

    private static String headerOrNull(InboundRequest request, String name) {
        String value = request.header(name);
        return (value == null || value.isBlank()) ? null : value;
    }
}
