/**
 * Library exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.servicelog.exception.ServiceLogException} - Base exception
 *       for all library errors</li>
 *   <li>{@link com.phillippitts.servicelog.exception.InvalidLevelException} - Thrown when a
 *       logger is built with an out-of-range or unknown minimum level</li>
 *   <li>{@link com.phillippitts.servicelog.exception.SerializationException} - Thrown by a
 *       record serializer; recovered by the logger with a fallback line</li>
 *   <li>{@link com.phillippitts.servicelog.exception.AddressParseException} - Thrown when a
 *       peer address is not in {@code host:port} form; recovered during scope derivation</li>
 * </ul>
 *
 * <p>Only {@code InvalidLevelException} ever reaches callers, and only from construction.
 * Per-level logging calls do not throw.
 *
 * @see com.phillippitts.servicelog.logging.ServiceLogger
 * @since 1.0
 */
package com.phillippitts.servicelog.exception;
