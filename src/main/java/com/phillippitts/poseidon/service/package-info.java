/**
 * Service layer: forecast extraction, reconciliation and conversation sessions.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.extraction} - backend contract, the vision, OCR and direct API backends,
 *       and the parallel fan-out</li>
 *   <li>{@code service.validation} - plausibility ranges</li>
 *   <li>{@code service.reconcile} - sanitizing, scoring, gap-filling and synthetic fallback</li>
 *   <li>{@code service.session} - per-conversation state machine with expiry timers</li>
 *   <li>{@code service.conversation} - inbound operations, caption parsing, spot table, reports</li>
 *   <li>{@code service.metrics}, {@code service.health}, {@code service.events} - observability</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are Spring beans with constructor injection</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>Services are thread-safe for concurrent conversations</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.poseidon.service;
