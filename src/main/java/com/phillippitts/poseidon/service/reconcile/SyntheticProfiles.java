package com.phillippitts.poseidon.service.reconcile;

import com.phillippitts.poseidon.config.properties.PlausibilityProperties;
import com.phillippitts.poseidon.domain.FieldKind;
import com.phillippitts.poseidon.domain.ForecastSample;
import com.phillippitts.poseidon.domain.Provenance;
import com.phillippitts.poseidon.domain.TideExtreme;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Hand-authored "typical conditions" used when no backend produced usable data.
 *
 * <p>Each profile is internally consistent: ten hourly slots for every series and one high and
 * one low tide. A small random jitter keeps repeated fallbacks from looking identical; jittered
 * values are clamped to the plausibility ranges, so every synthetic sample passes validation.
 */
public class SyntheticProfiles {

    private static final double JITTER = 0.05;

    static final List<ForecastSample> PROFILES = List.of(
            // small clean morning, building a little
            ForecastSample.builder(Provenance.SYNTHETIC)
                    .waveHeights(0.8, 0.8, 0.9, 0.9, 1.0, 1.0, 1.1, 1.1, 1.0, 1.0)
                    .wavePeriods(11.0, 11.0, 11.5, 11.5, 12.0, 12.0, 12.0, 11.5, 11.5, 11.0)
                    .wavePowers(180.0, 185.0, 210.0, 215.0, 250.0, 255.0, 290.0, 280.0, 240.0, 230.0)
                    .windSpeeds(1.5, 2.0, 2.5, 3.0, 4.0, 4.5, 5.0, 5.0, 4.5, 4.0)
                    .tide(TideExtreme.low(LocalTime.of(7, 10), 0.4))
                    .tide(TideExtreme.high(LocalTime.of(13, 25), 2.1))
                    .build(),
            // solid mid-size groundswell
            ForecastSample.builder(Provenance.SYNTHETIC)
                    .waveHeights(1.6, 1.7, 1.7, 1.8, 1.8, 1.9, 1.9, 1.8, 1.8, 1.7)
                    .wavePeriods(14.0, 14.0, 14.5, 14.5, 15.0, 15.0, 14.5, 14.5, 14.0, 14.0)
                    .wavePowers(620.0, 650.0, 690.0, 720.0, 760.0, 800.0, 780.0, 740.0, 700.0, 660.0)
                    .windSpeeds(2.0, 2.5, 3.0, 3.5, 4.5, 5.5, 6.0, 6.0, 5.5, 5.0)
                    .tide(TideExtreme.high(LocalTime.of(8, 40), 2.3))
                    .tide(TideExtreme.low(LocalTime.of(14, 55), 0.3))
                    .build(),
            // short-period windswell, onshore afternoon
            ForecastSample.builder(Provenance.SYNTHETIC)
                    .waveHeights(1.1, 1.1, 1.2, 1.2, 1.3, 1.3, 1.4, 1.4, 1.3, 1.3)
                    .wavePeriods(8.0, 8.0, 8.5, 8.5, 9.0, 9.0, 8.5, 8.5, 8.0, 8.0)
                    .wavePowers(140.0, 140.0, 160.0, 165.0, 190.0, 195.0, 200.0, 195.0, 170.0, 160.0)
                    .windSpeeds(4.0, 5.0, 6.0, 7.0, 8.0, 9.0, 9.5, 9.0, 8.0, 7.0)
                    .tide(TideExtreme.low(LocalTime.of(10, 5), 0.6))
                    .tide(TideExtreme.high(LocalTime.of(16, 20), 1.9))
                    .build()
    );

    private final RandomGenerator random;
    private final PlausibilityProperties ranges;

    public SyntheticProfiles(RandomGenerator random, PlausibilityProperties ranges) {
        this.random = Objects.requireNonNull(random, "random");
        this.ranges = Objects.requireNonNull(ranges, "ranges");
    }

    /**
     * @return a jittered copy of one profile, tagged {@link Provenance#SYNTHETIC}
     */
    public ForecastSample next() {
        ForecastSample profile = PROFILES.get(random.nextInt(PROFILES.size()));
        return ForecastSample.builder(Provenance.SYNTHETIC)
                .waveHeights(jitter(FieldKind.WAVE_HEIGHT, profile.waveHeights()))
                .wavePeriods(jitter(FieldKind.WAVE_PERIOD, profile.wavePeriods()))
                .wavePowers(jitter(FieldKind.WAVE_POWER, profile.wavePowers()))
                .windSpeeds(jitter(FieldKind.WIND_SPEED, profile.windSpeeds()))
                .tides(profile.tideExtremes())
                .build();
    }

    private List<Double> jitter(FieldKind field, List<Double> values) {
        PlausibilityProperties.Range range = ranges.rangeFor(field);
        double factor = 1.0 + (random.nextDouble() * 2.0 - 1.0) * JITTER;
        List<Double> out = new ArrayList<>(values.size());
        for (double v : values) {
            double j = Math.round(v * factor * 10.0) / 10.0;
            out.add(Math.max(range.min(), Math.min(range.max(), j)));
        }
        return out;
    }
}
