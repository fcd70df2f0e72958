package com.phillippitts.servicelog.logging;

import com.phillippitts.servicelog.testutil.CapturingLogSink;
import com.phillippitts.servicelog.testutil.FakeInboundRequest;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScopedLoggerTest {

    private CapturingLogSink sink;
    private ServiceLogger parent;

    @BeforeEach
    void setUp() {
        sink = new CapturingLogSink();
        parent = ServiceLogger.builder(sink, "logtest").minimumLevel(Level.INFO).build();
    }

    @Test
    void addsTraceAndClientFields() {
        FakeInboundRequest request = FakeInboundRequest.from("10.1.2.3:51234")
                .withHeader("X-Request-ID", "abc-123");

        parent.forRequest(request).info("Handled %s", "upload");

        JSONObject record = sink.lastRecord();
        assertThat(record.getString("message")).isEqualTo("Handled upload");
        assertThat(record.getJSONObject("trace").getString("id")).isEqualTo("abc-123");
        assertThat(record.getJSONObject("client").getString("ip")).isEqualTo("10.1.2.3");
        assertThat(record.getJSONObject("client").getString("port")).isEqualTo("51234");
        assertThat(record.getJSONObject("service").getString("name")).isEqualTo("logtest");
        assertThat(record.has("network")).isFalse();
    }

    @Test
    void omitsTraceWhenRequestIdHeaderMissing() {
        parent.forRequest(FakeInboundRequest.from("10.1.2.3:51234")).info("no trace");

        JSONObject record = sink.lastRecord();
        assertThat(record.has("trace")).isFalse();
        assertThat(record.has("client")).isTrue();
    }

    @Test
    void treatsBlankRequestIdAsAbsent() {
        FakeInboundRequest request = FakeInboundRequest.from("10.1.2.3:51234")
                .withHeader("X-Request-ID", "   ");

        ScopedLogger scoped = parent.forRequest(request);
        scoped.info("blank trace");

        assertThat(scoped.trace()).isEmpty();
        assertThat(sink.lastRecord().has("trace")).isFalse();
    }

    @Test
    void addsForwardedForAsNetworkBlock() {
        FakeInboundRequest request = FakeInboundRequest.from("10.0.0.1:8443")
                .withHeader("X-Forwarded-For", "203.0.113.7");

        parent.forRequest(request).warning("proxied");

        JSONObject record = sink.lastRecord();
        assertThat(record.getJSONObject("network").getString("forwarded_ip")).isEqualTo("203.0.113.7");
        assertThat(record.getJSONObject("log").getString("level")).isEqualTo("WARNING");
    }

    @Test
    void splitsBracketedIpv6PeerAddress() {
        parent.forRequest(FakeInboundRequest.from("[::1]:8080")).info("local");

        JSONObject client = sink.lastRecord().getJSONObject("client");
        assertThat(client.getString("ip")).isEqualTo("::1");
        assertThat(client.getString("port")).isEqualTo("8080");
    }

    @Test
    void unparseableAddressIsReportedAndScopeHasNoClient() {
        FakeInboundRequest request = FakeInboundRequest.from("not-an-address")
                .withHeader("X-Request-ID", "r-1");

        ScopedLogger scoped = parent.forRequest(request);

        assertThat(sink.size()).isEqualTo(1);
        JSONObject report = sink.lastRecord();
        assertThat(report.getJSONObject("log").getString("level")).isEqualTo("ERROR");
        assertThat(report.getString("message")).isEqualTo("Unable to parse \"not-an-address\" as IP:port");

        scoped.info("after failure");

        JSONObject record = sink.lastRecord();
        assertThat(record.has("client")).isFalse();
        assertThat(record.getJSONObject("trace").getString("id")).isEqualTo("r-1");
        assertThat(scoped.client()).isEmpty();
    }

    @Test
    void missingPeerAddressIsNotAnError() {
        ScopedLogger scoped = parent.forRequest(FakeInboundRequest.from(null));

        assertThat(sink.size()).isZero();
        assertThat(scoped.client()).isEmpty();
    }

    @Test
    void filteringFollowsParentMinimumLevel() {
        ScopedLogger scoped = parent.forRequest(FakeInboundRequest.from("10.1.2.3:1"));

        scoped.debug("hidden");

        assertThat(sink.size()).isZero();
    }

    @Test
    void invalidRankIsCoercedToErrorWithScopeFields() {
        FakeInboundRequest request = FakeInboundRequest.from("10.1.2.3:1")
                .withHeader("X-Request-ID", "r-9");

        parent.forRequest(request).log(-1, "odd");

        assertThat(sink.size()).isEqualTo(2);
        assertThat(sink.records().get(0).getString("message")).contains("Invalid log level specified (-1)");
        JSONObject record = sink.lastRecord();
        assertThat(record.getJSONObject("log").getString("level")).isEqualTo("ERROR");
        assertThat(record.getJSONObject("trace").getString("id")).isEqualTo("r-9");
    }

    @Test
    void argumentWhoseToStringThrowsIsLoggedWithScopeFields() {
        Object broken = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("toString exploded");
            }
        };
        FakeInboundRequest request = FakeInboundRequest.from("10.1.2.3:1")
                .withHeader("X-Request-ID", "r-3");

        parent.forRequest(request).error("value=%s", broken);

        JSONObject record = sink.lastRecord();
        assertThat(record.getString("message")).endsWith("(IllegalStateException: toString exploded)");
        assertThat(record.getJSONObject("trace").getString("id")).isEqualTo("r-3");
    }

    @Test
    void scopeDoesNotAlterParentRecords() {
        FakeInboundRequest request = FakeInboundRequest.from("10.1.2.3:1")
                .withHeader("X-Request-ID", "r-2")
                .withHeader("X-Forwarded-For", "198.51.100.2");
        ScopedLogger scoped = parent.forRequest(request);

        parent.info("direct");

        JSONObject record = sink.lastRecord();
        assertThat(record.has("trace")).isFalse();
        assertThat(record.has("client")).isFalse();
        assertThat(record.has("network")).isFalse();
        assertThat(scoped.parent()).isSameAs(parent);
    }
}
