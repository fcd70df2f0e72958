package com.phillippitts.servicelog.logging;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * {@link LogSink} over an {@link OutputStream}. Writes and flushes each line under the
 * stream's monitor so concurrent lines do not interleave.
 */
final class OutputStreamLogSink implements LogSink {

    private final OutputStream out;

    OutputStreamLogSink(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void write(byte[] line) {
        synchronized (out) {
            try {
                out.write(line);
                out.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to write log line", e);
            }
        }
    }
}
