package com.phillippitts.poseidon.config.properties;

import com.phillippitts.poseidon.domain.FieldKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Inclusive plausibility ranges per numeric forecast field.
 *
 * <p>The ranges reject obviously garbled extraction; they are not a claim of physical accuracy.
 * Defaults:
 * <pre>
 * poseidon.plausibility.wave-height.min=0.1
 * poseidon.plausibility.wave-height.max=6.0
 * poseidon.plausibility.wave-period.min=3.0
 * poseidon.plausibility.wave-period.max=22.0
 * poseidon.plausibility.wave-power.min=30
 * poseidon.plausibility.wave-power.max=1600
 * poseidon.plausibility.wind-speed.min=0.0
 * poseidon.plausibility.wind-speed.max=15.0
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "poseidon.plausibility")
public class PlausibilityProperties {

    public static final Range DEFAULT_WAVE_HEIGHT = new Range(0.1, 6.0);
    public static final Range DEFAULT_WAVE_PERIOD = new Range(3.0, 22.0);
    public static final Range DEFAULT_WAVE_POWER = new Range(30.0, 1600.0);
    public static final Range DEFAULT_WIND_SPEED = new Range(0.0, 15.0);

    /**
     * Inclusive numeric bounds.
     */
    public record Range(double min, double max) {
        public Range {
            if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
                throw new IllegalArgumentException("range min must be <= max, got [" + min + ", " + max + "]");
            }
        }

        public boolean contains(double value) {
            return !Double.isNaN(value) && value >= min && value <= max;
        }
    }

    private final Range waveHeight;
    private final Range wavePeriod;
    private final Range wavePower;
    private final Range windSpeed;

    @ConstructorBinding
    public PlausibilityProperties(Range waveHeight, Range wavePeriod, Range wavePower, Range windSpeed) {
        this.waveHeight = waveHeight == null ? DEFAULT_WAVE_HEIGHT : waveHeight;
        this.wavePeriod = wavePeriod == null ? DEFAULT_WAVE_PERIOD : wavePeriod;
        this.wavePower = wavePower == null ? DEFAULT_WAVE_POWER : wavePower;
        this.windSpeed = windSpeed == null ? DEFAULT_WIND_SPEED : windSpeed;
    }

    /**
     * Properties with every range at its default.
     */
    public static PlausibilityProperties defaults() {
        return new PlausibilityProperties(null, null, null, null);
    }

    public Range rangeFor(FieldKind field) {
        return switch (field) {
            case WAVE_HEIGHT -> waveHeight;
            case WAVE_PERIOD -> wavePeriod;
            case WAVE_POWER -> wavePower;
            case WIND_SPEED -> windSpeed;
            case TIDE_EXTREMES -> throw new IllegalArgumentException("tide extremes have no numeric range");
        };
    }

    public Range getWaveHeight() {
        return waveHeight;
    }

    public Range getWavePeriod() {
        return wavePeriod;
    }

    public Range getWavePower() {
        return wavePower;
    }

    public Range getWindSpeed() {
        return windSpeed;
    }
}
