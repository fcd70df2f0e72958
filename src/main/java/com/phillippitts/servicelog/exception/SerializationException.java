package com.phillippitts.servicelog.exception;

/**
 * Thrown when a log record cannot be rendered to its wire form.
 * The logger recovers from it locally by emitting a fallback line.
 */
public class SerializationException extends ServiceLogException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
