/**
 * Logging infrastructure (MDC/ThreadContext population per HTTP request).
 */
package com.phillippitts.poseidon.config.logging;
