/**
 * Servlet filters that sit at the request boundary.
 *
 * <ul>
 *   <li>{@link com.phillippitts.servicelog.web.LoggerInjectingFilter} - attaches a scoped
 *       logger to each request</li>
 *   <li>{@link com.phillippitts.servicelog.web.RequestMetricsFilter} - reports request count
 *       and duration per status and method</li>
 * </ul>
 */
package com.phillippitts.servicelog.web;
