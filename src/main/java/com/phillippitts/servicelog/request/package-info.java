/**
 * Extraction of request-scoped enrichment values.
 *
 * <p>{@link com.phillippitts.servicelog.request.RequestEnrichment} reads the
 * {@code X-Request-ID} and {@code X-Forwarded-For} headers and the peer address from an
 * {@link com.phillippitts.servicelog.request.InboundRequest}. Nothing in this package logs;
 * reporting a malformed peer address is left to the caller.
 */
package com.phillippitts.servicelog.request;
