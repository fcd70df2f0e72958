package com.phillippitts.servicelog.logging;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;

/**
 * Buffers bytes until a newline and hands each complete line to {@link ServiceLogger#write}.
 *
 * <p>Lets line-oriented writers that emit a line in several pieces ({@link java.io.PrintStream},
 * for one) produce exactly one record per line. {@link #close()} logs any unterminated remainder.
 */
final class LineOutputStream extends OutputStream {

    private final ServiceLogger target;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream(256);

    LineOutputStream(ServiceLogger target) {
        this.target = target;
    }

    @Override
    public synchronized void write(int b) {
        pending.write(b);
        if (b == '\n') {
            drain();
        }
    }

    @Override
    public synchronized void write(byte[] bytes, int offset, int length) {
        int start = offset;
        int end = offset + length;
        for (int i = offset; i < end; i++) {
            if (bytes[i] == '\n') {
                pending.write(bytes, start, i + 1 - start);
                drain();
                start = i + 1;
            }
        }
        if (start < end) {
            pending.write(bytes, start, end - start);
        }
    }

    @Override
    public synchronized void close() {
        if (pending.size() > 0) {
            drain();
        }
    }

    private void drain() {
        byte[] line = pending.toByteArray();
        pending.reset();
        target.write(line);
    }
}
