package com.phillippitts.poseidon.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable surf forecast dataset, either a candidate produced by one extraction backend
 * or the reconciled result handed to the presentation layer.
 *
 * <p>Numeric series are ordered per hourly slot. Sequences may be shorter than the canonical
 * slot count; consumers must tolerate variable lengths. An empty list means "absent".
 *
 * @param waveHeights  wave heights in meters
 * @param wavePeriods  wave periods in seconds
 * @param wavePowers   wave power in kilojoules
 * @param windSpeeds   wind speeds in m/s
 * @param tideExtremes tide turning points of the day
 * @param provenance   which source produced this sample
 */
public record ForecastSample(
        List<Double> waveHeights,
        List<Double> wavePeriods,
        List<Double> wavePowers,
        List<Double> windSpeeds,
        List<TideExtreme> tideExtremes,
        Provenance provenance
) {

    /**
     * Compact constructor: null lists are normalized to empty, all lists are copied.
     *
     * @throws NullPointerException if provenance or a list element is null
     */
    public ForecastSample {
        waveHeights = waveHeights == null ? List.of() : List.copyOf(waveHeights);
        wavePeriods = wavePeriods == null ? List.of() : List.copyOf(wavePeriods);
        wavePowers = wavePowers == null ? List.of() : List.copyOf(wavePowers);
        windSpeeds = windSpeeds == null ? List.of() : List.copyOf(windSpeeds);
        tideExtremes = tideExtremes == null ? List.of() : List.copyOf(tideExtremes);
        Objects.requireNonNull(provenance, "provenance");
    }

    public static ForecastSample empty(Provenance provenance) {
        return new ForecastSample(null, null, null, null, null, provenance);
    }

    public static Builder builder(Provenance provenance) {
        return new Builder(provenance);
    }

    /**
     * Returns the numeric series for the given field.
     *
     * @throws IllegalArgumentException for {@link FieldKind#TIDE_EXTREMES}
     */
    public List<Double> series(FieldKind field) {
        return switch (field) {
            case WAVE_HEIGHT -> waveHeights;
            case WAVE_PERIOD -> wavePeriods;
            case WAVE_POWER -> wavePowers;
            case WIND_SPEED -> windSpeeds;
            case TIDE_EXTREMES -> throw new IllegalArgumentException("tide extremes are not a numeric series");
        };
    }

    /**
     * @return true if the field holds at least one value
     */
    public boolean has(FieldKind field) {
        if (field == FieldKind.TIDE_EXTREMES) {
            return !tideExtremes.isEmpty();
        }
        return !series(field).isEmpty();
    }

    /**
     * @return true if no field holds any value
     */
    public boolean isEmpty() {
        for (FieldKind field : FieldKind.values()) {
            if (has(field)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a copy with the given field cleared to empty.
     */
    public ForecastSample without(FieldKind field) {
        return switch (field) {
            case WAVE_HEIGHT -> new ForecastSample(null, wavePeriods, wavePowers, windSpeeds, tideExtremes, provenance);
            case WAVE_PERIOD -> new ForecastSample(waveHeights, null, wavePowers, windSpeeds, tideExtremes, provenance);
            case WAVE_POWER -> new ForecastSample(waveHeights, wavePeriods, null, windSpeeds, tideExtremes, provenance);
            case WIND_SPEED -> new ForecastSample(waveHeights, wavePeriods, wavePowers, null, tideExtremes, provenance);
            case TIDE_EXTREMES -> new ForecastSample(waveHeights, wavePeriods, wavePowers, windSpeeds, null, provenance);
        };
    }

    /**
     * Returns a copy whose given field is replaced by the donor's value for that field.
     */
    public ForecastSample withFieldFrom(FieldKind field, ForecastSample donor) {
        Objects.requireNonNull(donor, "donor");
        return switch (field) {
            case WAVE_HEIGHT -> new ForecastSample(donor.waveHeights, wavePeriods, wavePowers, windSpeeds,
                    tideExtremes, provenance);
            case WAVE_PERIOD -> new ForecastSample(waveHeights, donor.wavePeriods, wavePowers, windSpeeds,
                    tideExtremes, provenance);
            case WAVE_POWER -> new ForecastSample(waveHeights, wavePeriods, donor.wavePowers, windSpeeds,
                    tideExtremes, provenance);
            case WIND_SPEED -> new ForecastSample(waveHeights, wavePeriods, wavePowers, donor.windSpeeds,
                    tideExtremes, provenance);
            case TIDE_EXTREMES -> new ForecastSample(waveHeights, wavePeriods, wavePowers, windSpeeds,
                    donor.tideExtremes, provenance);
        };
    }

    public ForecastSample withProvenance(Provenance newProvenance) {
        return new ForecastSample(waveHeights, wavePeriods, wavePowers, windSpeeds, tideExtremes, newProvenance);
    }

    /**
     * Fluent builder, mostly used by parsers and tests.
     */
    public static final class Builder {
        private final Provenance provenance;
        private List<Double> waveHeights = List.of();
        private List<Double> wavePeriods = List.of();
        private List<Double> wavePowers = List.of();
        private List<Double> windSpeeds = List.of();
        private final List<TideExtreme> tides = new ArrayList<>();

        private Builder(Provenance provenance) {
            this.provenance = Objects.requireNonNull(provenance, "provenance");
        }

        public Builder waveHeights(Double... values) {
            return waveHeights(Arrays.asList(values));
        }

        public Builder waveHeights(List<Double> values) {
            this.waveHeights = values;
            return this;
        }

        public Builder wavePeriods(Double... values) {
            return wavePeriods(Arrays.asList(values));
        }

        public Builder wavePeriods(List<Double> values) {
            this.wavePeriods = values;
            return this;
        }

        public Builder wavePowers(Double... values) {
            return wavePowers(Arrays.asList(values));
        }

        public Builder wavePowers(List<Double> values) {
            this.wavePowers = values;
            return this;
        }

        public Builder windSpeeds(Double... values) {
            return windSpeeds(Arrays.asList(values));
        }

        public Builder windSpeeds(List<Double> values) {
            this.windSpeeds = values;
            return this;
        }

        public Builder tide(TideExtreme extreme) {
            this.tides.add(extreme);
            return this;
        }

        public Builder tides(List<TideExtreme> extremes) {
            this.tides.clear();
            this.tides.addAll(extremes);
            return this;
        }

        public ForecastSample build() {
            return new ForecastSample(waveHeights, wavePeriods, wavePowers, windSpeeds, tides, provenance);
        }
    }
}
