/**
 * Logging infrastructure: request-scoped MDC values for Log4j2.
 *
 * @see com.phillippitts.tastemodel.config.logging.MdcFilter
 */
package com.phillippitts.tastemodel.config.logging;
