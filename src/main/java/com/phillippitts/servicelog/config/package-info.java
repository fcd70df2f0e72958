/**
 * Spring configuration for the service logger.
 *
 * <p>{@link com.phillippitts.servicelog.config.ServiceLogProperties} binds
 * {@code servicelog.*} from {@code application.properties};
 * {@link com.phillippitts.servicelog.config.ServiceLogConfig} turns it into beans.
 *
 * @since 1.0
 */
package com.phillippitts.servicelog.config;
