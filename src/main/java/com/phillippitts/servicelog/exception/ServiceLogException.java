package com.phillippitts.servicelog.exception;

/**
 * Base exception for all servicelog-specific errors.
 * All library exceptions extend this class so callers can handle them in one place.
 */
public class ServiceLogException extends RuntimeException {

    public ServiceLogException(String message) {
        super(message);
    }

    public ServiceLogException(String message, Throwable cause) {
        super(message, cause);
    }

    public ServiceLogException(Throwable cause) {
        super(cause);
    }
}
