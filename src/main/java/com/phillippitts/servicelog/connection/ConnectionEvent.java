package com.phillippitts.servicelog.connection;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one connection attempt reported by a driver's connection layer.
 *
 * @param address target address of the attempt
 * @param error   failure cause, or null when the connection opened
 */
public record ConnectionEvent(String address, Throwable error) {

    public ConnectionEvent {
        Objects.requireNonNull(address, "Address must not be null");
    }

    public static ConnectionEvent opened(String address) {
        return new ConnectionEvent(address, null);
    }

    public static ConnectionEvent failed(String address, Throwable error) {
        return new ConnectionEvent(address, Objects.requireNonNull(error, "Error must not be null"));
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(error);
    }
}
