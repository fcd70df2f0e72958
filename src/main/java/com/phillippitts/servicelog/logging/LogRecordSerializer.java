package com.phillippitts.servicelog.logging;

import com.phillippitts.servicelog.exception.SerializationException;

/**
 * Renders a {@link LogRecord} to a single line of text (without the trailing newline).
 */
@FunctionalInterface
public interface LogRecordSerializer {

    /**
     * @throws SerializationException if the record cannot be rendered
     */
    String serialize(LogRecord record);
}
