package com.phillippitts.poseidon.exception;

import com.phillippitts.poseidon.domain.FailureKind;

/**
 * Thrown inside an extraction backend when it cannot produce a candidate.
 * Never escapes the backend: it is converted to a failed
 * {@link com.phillippitts.poseidon.domain.CandidateResult} with the same {@link FailureKind}.
 */
public class ExtractionException extends PoseidonException {

    private final String backend;
    private final FailureKind kind;

    public ExtractionException(String message, String backend, FailureKind kind) {
        super(message + " (backend: " + backend + ")");
        this.backend = backend;
        this.kind = kind;
    }

    public ExtractionException(String message, String backend, FailureKind kind, Throwable cause) {
        super(message + " (backend: " + backend + ")", cause);
        this.backend = backend;
        this.kind = kind;
    }

    public String getBackend() {
        return backend;
    }

    public FailureKind getKind() {
        return kind;
    }
}
