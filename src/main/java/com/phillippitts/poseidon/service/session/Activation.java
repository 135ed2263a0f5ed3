package com.phillippitts.poseidon.service.session;

/**
 * Result of {@link SessionController#activate(String)}.
 */
public enum Activation {
    /** The session moved to ACTIVE. */
    ACTIVATED,
    /** The session was already ACTIVE; nothing changed. */
    ALREADY_ACTIVE
}
