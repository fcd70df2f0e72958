package com.phillippitts.servicelog.request;

import com.phillippitts.servicelog.exception.AddressParseException;

/**
 * A peer address split into host and port.
 *
 * <p>Accepts {@code host:port} and {@code [host]:port}; the brackets are required when the
 * host itself contains colons (IPv6). The port is kept as text and may be empty.
 *
 * @param host host or IP literal, without brackets
 * @param port port text
 */
public record HostPort(String host, String port) {

    /**
     * @throws AddressParseException if the address is null or not in one of the accepted forms
     */
    public static HostPort split(String address) {
        if (address == null) {
            throw new AddressParseException(null, "missing address");
        }
        int lastColon = address.lastIndexOf(':');
        if (lastColon < 0) {
            throw new AddressParseException(address, "missing port in address");
        }

        String host;
        int openFrom = 0;
        int closeFrom = 0;
        if (address.startsWith("[")) {
            int close = address.indexOf(']');
            if (close < 0) {
                throw new AddressParseException(address, "missing ']' in address");
            }
            if (close + 1 == address.length()) {
                throw new AddressParseException(address, "missing port in address");
            }
            if (close + 1 != lastColon) {
                throw new AddressParseException(address,
                        address.charAt(close + 1) == ':' ? "too many colons in address" : "missing port in address");
            }
            host = address.substring(1, close);
            openFrom = 1;
            closeFrom = close + 1;
        } else {
            host = address.substring(0, lastColon);
            if (host.indexOf(':') >= 0) {
                throw new AddressParseException(address, "too many colons in address");
            }
        }
        if (address.indexOf('[', openFrom) >= 0) {
            throw new AddressParseException(address, "unexpected '[' in address");
        }
        if (address.indexOf(']', closeFrom) >= 0) {
            throw new AddressParseException(address, "unexpected ']' in address");
        }

        String port = address.substring(lastColon + 1);
        return new HostPort(host, port);
    }

    /**
     * Inverse of {@link #split(String)}: brackets the host when it contains a colon.
     */
    public static String join(String host, String port) {
        if (host.indexOf(':') >= 0) {
            return "[" + host + "]:" + port;
        }
        return host + ":" + port;
    }
}
