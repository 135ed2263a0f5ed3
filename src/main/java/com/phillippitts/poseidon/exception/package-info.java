/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.poseidon.exception.PoseidonException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.poseidon.exception.ExtractionException} - A backend could not
 *       produce a candidate; always recovered inside the reconciliation engine</li>
 *   <li>{@link com.phillippitts.poseidon.exception.UnknownSpotException} - The requested spot is
 *       not in the directory; surfaced as a fixed reply</li>
 *   <li>{@link com.phillippitts.poseidon.exception.SessionNotActiveException} - An image arrived
 *       outside an active session; surfaced as a fixed refusal</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining. Residual exceptions at the HTTP
 * boundary are mapped by {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.poseidon.exception;
