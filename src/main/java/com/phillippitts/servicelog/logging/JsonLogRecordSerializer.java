package com.phillippitts.servicelog.logging;

import com.phillippitts.servicelog.exception.SerializationException;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Serializes records to single-line ECS JSON using org.json.
 *
 * <p>Blank members are left out, and a block with no remaining members is left out as a
 * whole, so the output never carries {@code null} or {@code {}} for absent data.
 *
 * <p>Thread-safe: stateless.
 */
public final class JsonLogRecordSerializer implements LogRecordSerializer {

    /** ECS schema version stamped on every record. */
    public static final String ECS_VERSION = "1.7.0";

    @Override
    public String serialize(LogRecord record) {
        try {
            JSONObject root = new JSONObject();
            root.put("@timestamp", record.timestamp());
            root.put("message", record.message());
            root.put("ecs", new JSONObject().put("version", ECS_VERSION));
            root.put("log", new JSONObject().put("level", record.level().name()));

            JSONObject service = new JSONObject();
            service.put("name", record.service().name());
            putIfPresent(service, "type", record.service().type());
            root.put("service", service);

            if (record.client() != null) {
                JSONObject client = new JSONObject();
                putIfPresent(client, "ip", record.client().ip());
                putIfPresent(client, "port", record.client().port());
                putIfNotEmpty(root, "client", client);
            }
            if (record.network() != null) {
                JSONObject network = new JSONObject();
                putIfPresent(network, "forwarded_ip", record.network().forwardedIp());
                putIfNotEmpty(root, "network", network);
            }
            if (record.trace() != null) {
                JSONObject trace = new JSONObject();
                putIfPresent(trace, "id", record.trace().id());
                putIfNotEmpty(root, "trace", trace);
            }
            return root.toString();
        } catch (JSONException e) {
            throw new SerializationException("Unable to serialize log record", e);
        }
    }

    private static void putIfPresent(JSONObject target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value);
        }
    }

    private static void putIfNotEmpty(JSONObject target, String key, JSONObject block) {
        if (!block.isEmpty()) {
            target.put(key, block);
        }
    }
}
