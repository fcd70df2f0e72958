package com.phillippitts.servicelog.logging;

import java.io.OutputStream;

/**
 * Destination for finished log lines.
 *
 * <p>Each call receives exactly one complete, newline-terminated line. Implementations shared
 * between threads must keep a line intact; the logger itself does no locking.
 */
@FunctionalInterface
public interface LogSink {

    /**
     * Writes one line. Failures are the environment's problem and are not handled by the logger.
     *
     * @param line UTF-8 bytes of one record, including the trailing newline
     */
    void write(byte[] line);

    static LogSink of(OutputStream out) {
        return new OutputStreamLogSink(out);
    }

    static LogSink stdout() {
        return of(System.out);
    }

    static LogSink stderr() {
        return of(System.err);
    }
}
