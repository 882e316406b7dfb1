/**
 * Request-scoped logging context (Log4j2 ThreadContext).
 */
package com.phillippitts.audiolink.config.logging;
