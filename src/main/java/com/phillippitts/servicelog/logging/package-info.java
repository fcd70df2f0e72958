/**
 * ECS-shaped JSON-lines logging.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.servicelog.logging.ServiceLogger} - leveled logger bound to a
 *       sink and a service identity</li>
 *   <li>{@link com.phillippitts.servicelog.logging.ScopedLogger} - per-request view that adds
 *       client, network and trace fields</li>
 *   <li>{@link com.phillippitts.servicelog.logging.LogRecord} - the record schema</li>
 *   <li>{@link com.phillippitts.servicelog.logging.ServiceLoggerAppender} - redirects Log4j2
 *       output into a service logger</li>
 * </ul>
 *
 * <p>Log Format (one object per line):
 * <pre>
 * {"@timestamp":"2025-10-17T15:42:32Z","message":"...","ecs":{"version":"1.7.0"},
 *  "log":{"level":"INFO"},"service":{"name":"..."},"trace":{"id":"..."}}
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.servicelog.logging;
