/**
 * Spring configuration: properties, the modem pool and executor, CORS, and logging context.
 */
package com.phillippitts.audiolink.config;
