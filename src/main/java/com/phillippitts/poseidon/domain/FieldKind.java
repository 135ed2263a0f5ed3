package com.phillippitts.poseidon.domain;

/**
 * Fields of a {@link ForecastSample} that are validated, scored and gap-filled independently.
 */
public enum FieldKind {
    WAVE_HEIGHT,
    WAVE_PERIOD,
    WAVE_POWER,
    WIND_SPEED,
    TIDE_EXTREMES;

    /**
     * @return true for the four numeric per-slot series, false for tide extremes
     */
    public boolean isNumericSeries() {
        return this != TIDE_EXTREMES;
    }
}
