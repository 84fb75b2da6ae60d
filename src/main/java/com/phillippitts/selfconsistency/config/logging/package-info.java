/**
 * Logging infrastructure: request correlation ids in the Log4j2 ThreadContext.
 */
package com.phillippitts.selfconsistency.config.logging;
