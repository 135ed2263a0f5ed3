package com.phillippitts.poseidon.domain;

/**
 * Typed reasons an extraction backend can fail to produce a candidate.
 */
public enum FailureKind {
    /** The backend did not answer within its own timeout. */
    TIMEOUT,
    /** The backend answered, but nothing usable could be parsed from the answer. */
    MALFORMED_OUTPUT,
    /** The backend is unreachable, misconfigured, or has no credentials. */
    BACKEND_UNAVAILABLE
}
