package com.phillippitts.poseidon.service.session;

/**
 * Lifecycle phase of one conversation.
 *
 * <pre>
 * IDLE → ACTIVE                      (trigger phrase)
 * ACTIVE → AWAITING_ACKNOWLEDGEMENT  (report delivered, expiry timer armed)
 * AWAITING_ACKNOWLEDGEMENT → IDLE    (acknowledgement text, or expiry)
 * </pre>
 */
public enum SessionPhase {
    IDLE,
    ACTIVE,
    AWAITING_ACKNOWLEDGEMENT
}
