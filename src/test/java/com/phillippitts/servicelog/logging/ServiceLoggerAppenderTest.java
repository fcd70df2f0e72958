package com.phillippitts.servicelog.logging;

import com.phillippitts.servicelog.testutil.CapturingLogSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceLoggerAppenderTest {

    private CapturingLogSink sink;
    private Logger log4jLogger;
    private ServiceLoggerAppender appender;

    @BeforeEach
    void setUp() {
        sink = new CapturingLogSink();
        ServiceLogger target = ServiceLogger.builder(sink, "redirect").build();

        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        log4jLogger = ctx.getLogger("com.phillippitts.servicelog.test.Redirected");
        log4jLogger.setLevel(org.apache.logging.log4j.Level.DEBUG);
        log4jLogger.setAdditive(false);
        appender = ServiceLoggerAppender.attachTo(log4jLogger, target);
    }

    @AfterEach
    void tearDown() {
        if (appender != null) {
            appender.detach();
        }
    }

    @Test
    void log4jEventBecomesWarningRecord() {
        log4jLogger.info("Cache warmed with {} entries", 42);

        assertThat(sink.size()).isEqualTo(1);
        JSONObject record = sink.lastRecord();
        assertThat(record.getString("message")).isEqualTo("Cache warmed with 42 entries");
        assertThat(record.getJSONObject("log").getString("level")).isEqualTo("WARNING");
        assertThat(record.getJSONObject("service").getString("name")).isEqualTo("redirect");
    }

    @Test
    void everyLog4jLevelArrivesAsWarning() {
        log4jLogger.debug("d");
        log4jLogger.error("e");

        assertThat(sink.records())
                .extracting(r -> r.getJSONObject("log").getString("level"))
                .containsExactly("WARNING", "WARNING");
    }

    @Test
    void detachStopsRedirect() {
        appender.detach();
        appender = null;

        log4jLogger.warn("after detach");

        assertThat(sink.size()).isZero();
        assertThat(log4jLogger.getAppenders()).doesNotContainKey(ServiceLoggerAppender.NAME);
    }

    @Test
    void detachFromAnotherThreadStopsRedirect() throws Exception {
        ServiceLoggerAppender attached = appender;
        appender = null;
        ExecutorService shutdownThread = Executors.newSingleThreadExecutor();
        try {
            shutdownThread.submit(attached::detach).get(5, TimeUnit.SECONDS);
        } finally {
            shutdownThread.shutdownNow();
        }

        log4jLogger.error("after shutdown");

        assertThat(sink.size()).isZero();
        assertThat(attached.isStopped()).isTrue();
        assertThat(log4jLogger.getAppenders()).doesNotContainKey(ServiceLoggerAppender.NAME);
    }
}
