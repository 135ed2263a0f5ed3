/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.poseidon.config.ThreadPoolConfig} - extraction executor and
 *       session timer scheduler</li>
 *   <li>{@link com.phillippitts.poseidon.config.ClockConfig} - application clock</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.backend} - extraction backend properties and HTTP clients</li>
 *   <li>{@code config.properties} - plausibility, reconciliation, session, conversation, spot
 *       and thread pool properties</li>
 *   <li>{@code config.reconcile} - reconciliation engine wiring</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.poseidon.config;
