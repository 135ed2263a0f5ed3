package com.phillippitts.poseidon.exception;

/**
 * Base exception for all Poseidon application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class PoseidonException extends RuntimeException {

    public PoseidonException(String message) {
        super(message);
    }

    public PoseidonException(String message, Throwable cause) {
        super(message, cause);
    }

    public PoseidonException(Throwable cause) {
        super(cause);
    }
}
