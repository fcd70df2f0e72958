package com.phillippitts.servicelog.exception;

/**
 * Thrown when a severity level is not one of DEBUG, INFO, WARNING, ERROR or FATAL.
 *
 * <p>Raised by logger construction, which fails closed. Call-time use of an invalid
 * level never surfaces this exception; the logger reports and corrects it instead.
 */
public class InvalidLevelException extends ServiceLogException {

    private final String rejectedValue;

    public InvalidLevelException(int rank) {
        super("Unsupported log level: " + rank);
        this.rejectedValue = String.valueOf(rank);
    }

    public InvalidLevelException(String name) {
        super("Unsupported log level: " + (name == null ? "null" : "\"" + name + "\""));
        this.rejectedValue = name;
    }

    /**
     * @return the rank or name that was rejected (may be null when a null name was given)
     */
    public String getRejectedValue() {
        return rejectedValue;
    }
}
