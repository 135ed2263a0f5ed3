package com.phillippitts.poseidon.exception;

/**
 * Thrown when a caption names a surf spot that is not in the spot directory.
 * No reconciliation is attempted for an unknown spot.
 */
public class UnknownSpotException extends PoseidonException {

    private final String spotName;

    public UnknownSpotException(String spotName) {
        super("Unknown surf spot: " + spotName);
        this.spotName = spotName;
    }

    public String getSpotName() {
        return spotName;
    }
}
