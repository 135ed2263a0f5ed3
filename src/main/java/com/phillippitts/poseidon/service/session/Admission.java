package com.phillippitts.poseidon.service.session;

/**
 * Result of {@link SessionController#beginReconciliation(String)}.
 */
public enum Admission {
    /** The caller now owns the single reconciliation slot of the conversation. */
    ADMITTED,
    /** The conversation is not ACTIVE. */
    NOT_ACTIVE,
    /** Another image of the same conversation is still being reconciled. */
    BUSY
}
