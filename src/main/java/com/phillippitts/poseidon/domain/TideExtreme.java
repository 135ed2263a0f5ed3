package com.phillippitts.poseidon.domain;

import java.time.LocalTime;
import java.util.Objects;

/**
 * A single tide turning point.
 *
 * @param time   local time of day of the extreme
 * @param height tide height in meters
 * @param kind   high or low water
 */
public record TideExtreme(LocalTime time, double height, TideKind kind) {

    public TideExtreme {
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(kind, "kind");
    }

    public static TideExtreme high(LocalTime time, double height) {
        return new TideExtreme(time, height, TideKind.HIGH);
    }

    public static TideExtreme low(LocalTime time, double height) {
        return new TideExtreme(time, height, TideKind.LOW);
    }
}
