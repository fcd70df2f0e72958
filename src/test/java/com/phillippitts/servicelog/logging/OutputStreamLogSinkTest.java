package com.phillippitts.servicelog.logging;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputStreamLogSinkTest {

    @Test
    void writesLinesInOrder() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        LogSink sink = LogSink.of(out);

        sink.write("{\"a\":1}\n".getBytes(StandardCharsets.UTF_8));
        sink.write("{\"b\":2}\n".getBytes(StandardCharsets.UTF_8));

        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}\n{\"b\":2}\n");
    }

    @Test
    void wrapsIoFailures() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("disk full");
            }
        };
        LogSink sink = LogSink.of(broken);

        assertThatThrownBy(() -> sink.write(new byte[]{'x', '\n'}))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessage("Unable to write log line")
                .hasRootCauseMessage("disk full");
    }
}
